package com.example.shorturl.store;

import lombok.Getter;

@Getter
public class DuplicateIdException extends RuntimeException {

    private final String id;

    public DuplicateIdException(String id, Throwable cause) {
        super("URL with ID '" + id + "' already exists", cause);
        this.id = id;
    }
}
