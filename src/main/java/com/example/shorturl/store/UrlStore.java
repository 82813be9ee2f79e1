package com.example.shorturl.store;

import com.example.shorturl.model.UrlListOptions;
import com.example.shorturl.model.UrlRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Undeclared failures surface as {@link org.springframework.dao.DataAccessException}s. */
public interface UrlStore {

    /**
     * Inserts a new record; never overwrites.
     *
     * @throws DuplicateIdException if the id is already taken, active or not
     */
    void create(UrlRecord record);

    /** Returns the record regardless of its active flag. */
    Optional<UrlRecord> getById(String id);

    /**
     * Writes the editable fields (original URL, description, expiry, active flag, update time).
     * Click count and last-access time are left as stored.
     *
     * @throws RecordNotFoundException if no record has this id
     */
    void update(UrlRecord record);

    /** @throws RecordNotFoundException if no record has this id */
    void softDelete(String id, Instant now);

    UrlPage list(String ownerKey, UrlListOptions options);

    boolean exists(String id);

    /** @throws RecordNotFoundException if no active record has this id */
    void incrementClick(String id, Instant now);

    /** @throws RecordNotFoundException if no active record has this id */
    void touchLastAccessed(String id, Instant now);

    List<String> findExpiredIds(Instant now);

    /** Deactivates every active record whose expiry is at or before {@code now}. */
    int expireSweep(Instant now);
}
