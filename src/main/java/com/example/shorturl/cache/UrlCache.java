package com.example.shorturl.cache;

import com.example.shorturl.model.UrlRecord;

import java.time.Duration;
import java.util.Optional;

/** May throw when the backend is unreachable; callers decide whether that is fatal. */
public interface UrlCache {

    void set(String id, UrlRecord record, Duration ttl);

    /** Empty on a miss. */
    Optional<UrlRecord> get(String id);

    void delete(String id);

    /** Increments a counter, (re)setting its expiry; returns the new value. */
    long incrementCounter(String key, Duration ttl);
}
