package com.example.shorturl.model;

/**
 * Request details captured at redirect time for the click-event log.
 */
public record ClickContext(String ipAddress, String userAgent, String referer) {

    public static ClickContext none() {
        return new ClickContext(null, null, null);
    }
}
