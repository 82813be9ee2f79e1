package com.example.shorturl.model;

import java.util.Arrays;

public enum SortField {
    CREATED_AT("created_at", "createdAt"),
    CLICK_COUNT("click_count", "clickCount"),
    LAST_ACCESSED_AT("last_accessed_at", "lastAccessedAt");

    private final String apiName;
    private final String property;

    SortField(String apiName, String property) {
        this.apiName = apiName;
        this.property = property;
    }

    public String apiName() {
        return apiName;
    }

    /** Entity attribute used for ordering. */
    public String property() {
        return property;
    }

    public static SortField fromApiName(String value) {
        return Arrays.stream(values())
                .filter(f -> f.apiName.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported sort field: " + value));
    }
}
