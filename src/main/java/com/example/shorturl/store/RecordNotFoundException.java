package com.example.shorturl.store;

import lombok.Getter;

@Getter
public class RecordNotFoundException extends RuntimeException {

    private final String id;

    public RecordNotFoundException(String id) {
        super("URL with ID '" + id + "' not found");
        this.id = id;
    }
}
