package com.example.shorturl.model;

public enum SortOrder {
    ASC,
    DESC;

    public static SortOrder fromApiName(String value) {
        for (SortOrder order : values()) {
            if (order.name().equalsIgnoreCase(value)) {
                return order;
            }
        }
        throw new IllegalArgumentException("Unsupported sort order: " + value);
    }
}
