package com.example.shorturl.repository;

import com.example.shorturl.model.UrlRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface UrlRecordRepository extends JpaRepository<UrlRecord, String> {

    Page<UrlRecord> findByOwnerKey(String ownerKey, Pageable pageable);

    Page<UrlRecord> findByOwnerKeyAndActive(String ownerKey, boolean active, Pageable pageable);

    long countByActiveTrue();

    // Counters are left out so a concurrent click increment is never overwritten.
    @Modifying(clearAutomatically = true)
    @Query("UPDATE UrlRecord u SET u.originalUrl = :originalUrl, u.description = :description, "
            + "u.expiresAt = :expiresAt, u.active = :active, u.updatedAt = :updatedAt WHERE u.id = :id")
    int updateDetails(@Param("id") String id,
                      @Param("originalUrl") String originalUrl,
                      @Param("description") String description,
                      @Param("expiresAt") Instant expiresAt,
                      @Param("active") boolean active,
                      @Param("updatedAt") Instant updatedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UrlRecord u SET u.active = false, u.updatedAt = :now WHERE u.id = :id")
    int softDelete(@Param("id") String id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UrlRecord u SET u.clickCount = u.clickCount + 1, u.lastAccessedAt = :now, u.updatedAt = :now "
            + "WHERE u.id = :id AND u.active = true")
    int incrementClickCount(@Param("id") String id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UrlRecord u SET u.lastAccessedAt = :now, u.updatedAt = :now WHERE u.id = :id AND u.active = true")
    int touchLastAccessed(@Param("id") String id, @Param("now") Instant now);

    @Query("SELECT u.id FROM UrlRecord u WHERE u.active = true AND u.expiresAt IS NOT NULL AND u.expiresAt <= :now")
    List<String> findExpiredIds(@Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UrlRecord u SET u.active = false, u.updatedAt = :now "
            + "WHERE u.active = true AND u.expiresAt IS NOT NULL AND u.expiresAt <= :now")
    int deactivateExpired(@Param("now") Instant now);
}
