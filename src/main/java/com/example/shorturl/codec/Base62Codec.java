package com.example.shorturl.codec;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;

@Component
public class Base62Codec {

    public static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final int BASE = ALPHABET.length();

    private final SecureRandom random;

    public Base62Codec() {
        this(new SecureRandom());
    }

    public Base62Codec(SecureRandom random) {
        this.random = random;
    }

    public String generateRandom(int length) {
        if (length < 1) {
            throw new IllegalArgumentException("length must be positive: " + length);
        }
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(BASE)));
        }
        return sb.toString();
    }

    public String encode(long number) {
        if (number < 0) {
            throw new IllegalArgumentException("number must be non-negative: " + number);
        }
        if (number == 0) {
            return "0";
        }
        StringBuilder sb = new StringBuilder();
        while (number > 0) {
            sb.append(ALPHABET.charAt((int) (number % BASE)));
            number /= BASE;
        }
        return sb.reverse().toString();
    }

    /** @throws InvalidCharacterException with the zero-based position of the first bad character */
    public long decode(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            throw new IllegalArgumentException("encoded value must not be empty");
        }
        long result = 0;
        for (int i = 0; i < encoded.length(); i++) {
            char c = encoded.charAt(i);
            int digit = ALPHABET.indexOf(c);
            if (digit < 0) {
                throw new InvalidCharacterException(c, i);
            }
            result = Math.addExact(Math.multiplyExact(result, BASE), digit);
        }
        return result;
    }

    public boolean isValidAlphabet(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (ALPHABET.indexOf(value.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }
}
