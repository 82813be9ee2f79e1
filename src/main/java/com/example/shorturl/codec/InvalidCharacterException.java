package com.example.shorturl.codec;

import lombok.Getter;

@Getter
public class InvalidCharacterException extends IllegalArgumentException {

    private final char character;
    private final int position;

    public InvalidCharacterException(char character, int position) {
        super("Invalid base62 character '" + character + "' at position " + position);
        this.character = character;
        this.position = position;
    }
}
