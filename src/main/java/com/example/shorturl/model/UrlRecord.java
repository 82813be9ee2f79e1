package com.example.shorturl.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

@Data
@Entity
@Table(name = "urls", indexes = {
        @Index(name = "idx_urls_created_by_api_key", columnList = "created_by_api_key"),
        @Index(name = "idx_urls_created_at", columnList = "created_at"),
        @Index(name = "idx_urls_expires_at", columnList = "expires_at"),
        @Index(name = "idx_urls_is_active", columnList = "is_active"),
        @Index(name = "idx_urls_click_count", columnList = "click_count")
})
public class UrlRecord implements Persistable<String> {

    @Id
    @Column(length = 50)
    private String id;

    @Column(name = "original_url", nullable = false, columnDefinition = "TEXT")
    private String originalUrl;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "click_count", nullable = false)
    private long clickCount;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "last_accessed_at")
    private Instant lastAccessedAt;

    @Column(name = "created_by_api_key", nullable = false)
    private String ownerKey;

    // Assigned ids make save() merge by default; a fresh record must always be inserted.
    @Transient
    @JsonIgnore
    private boolean newRecord;

    public static UrlRecord create(String id, String originalUrl, String description,
                                   Instant expiresAt, String ownerKey, Instant now) {
        UrlRecord record = new UrlRecord();
        record.setId(id);
        record.setOriginalUrl(originalUrl);
        record.setDescription(description);
        record.setExpiresAt(expiresAt);
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        record.setClickCount(0);
        record.setActive(true);
        record.setOwnerKey(ownerKey);
        record.setNewRecord(true);
        return record;
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public boolean isAccessible(Instant now) {
        return active && !isExpired(now);
    }

    @Override
    @JsonIgnore
    public boolean isNew() {
        return newRecord;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.newRecord = false;
    }
}
