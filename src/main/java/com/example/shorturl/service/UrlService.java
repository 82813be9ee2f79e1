package com.example.shorturl.service;

import com.example.shorturl.cache.UrlCache;
import com.example.shorturl.codec.Base62Codec;
import com.example.shorturl.config.ShortUrlProperties;
import com.example.shorturl.dto.CreateUrlRequest;
import com.example.shorturl.dto.PaginationMeta;
import com.example.shorturl.dto.UpdateUrlRequest;
import com.example.shorturl.dto.UrlListResponse;
import com.example.shorturl.dto.UrlResponse;
import com.example.shorturl.exception.ConflictException;
import com.example.shorturl.exception.ExpiredException;
import com.example.shorturl.exception.InternalException;
import com.example.shorturl.exception.NotFoundException;
import com.example.shorturl.exception.UnauthorizedException;
import com.example.shorturl.model.ClickContext;
import com.example.shorturl.model.UrlListOptions;
import com.example.shorturl.model.UrlRecord;
import com.example.shorturl.monitoring.UrlMetrics;
import com.example.shorturl.store.DuplicateIdException;
import com.example.shorturl.store.RecordNotFoundException;
import com.example.shorturl.store.UrlPage;
import com.example.shorturl.store.UrlStore;
import com.example.shorturl.task.BackgroundTasks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** The store is authoritative; cache failures never fail a request. */
@Slf4j
@Service
@RequiredArgsConstructor
public class UrlService {

    private static final String RESOURCE = "Short URL";

    private final UrlStore urlStore;
    private final UrlCache urlCache;
    private final Base62Codec codec;
    private final UrlValidator validator;
    private final BackgroundTasks backgroundTasks;
    private final ClickEventRecorder clickEventRecorder;
    private final UrlMetrics metrics;
    private final ShortUrlProperties properties;
    private final Clock clock;

    public UrlResponse create(CreateUrlRequest request, String ownerKey) {
        Instant now = clock.instant();
        validator.validateOriginalUrl(request.getOriginalUrl());
        validator.validateDescription(request.getDescription());
        validator.validateExpiresAt(request.getExpiresAt(), now);

        String customId = request.getCustomId() == null ? "" : request.getCustomId().trim();
        String id = customId.isEmpty() ? allocateRandomId() : reserveCustomId(customId);

        UrlRecord record = UrlRecord.create(id, request.getOriginalUrl(), request.getDescription(),
                request.getExpiresAt(), ownerKey, now);
        try {
            urlStore.create(record);
        } catch (DuplicateIdException e) {
            // lost the race between the availability check and the insert
            throw new ConflictException("URL ID", id, e);
        } catch (DataAccessException e) {
            log.error("Failed to create URL {} in database", id, e);
            throw new InternalException("Failed to save URL", e);
        }

        log.info("Created short URL {} -> {}", id, record.getOriginalUrl());
        cacheQuietly(record);
        return toResponse(record);
    }

    public UrlResponse resolve(String id) {
        return toResponse(resolveRecord(id));
    }

    public UrlResponse resolveForRedirect(String id, ClickContext context) {
        UrlRecord record = resolveRecord(id);
        metrics.redirect();

        Instant clickedAt = clock.instant();
        backgroundTasks.submit("click-accounting:" + id, () -> {
            try {
                urlStore.incrementClick(id, clickedAt);
            } finally {
                evictQuietly(id);
            }
        });
        if (clickEventRecorder.isEnabled()) {
            backgroundTasks.submit("click-event:" + id, () -> clickEventRecorder.record(id, context, clickedAt));
        }
        return toResponse(record);
    }

    /** Owner view of a record straight from the store, including inactive and expired ones. */
    public UrlResponse getStats(String id, String ownerKey) {
        UrlRecord record = loadRecord(id);
        checkOwner(record, ownerKey, "You don't have permission to view this URL's stats");
        return toResponse(record);
    }

    public UrlResponse update(String id, UpdateUrlRequest patch, String ownerKey) {
        UrlRecord record = loadRecord(id);
        checkOwner(record, ownerKey, "You don't have permission to update this URL");

        if (patch.getOriginalUrl() != null) {
            validator.validateOriginalUrl(patch.getOriginalUrl());
            record.setOriginalUrl(patch.getOriginalUrl());
        }
        if (patch.getDescription() != null) {
            validator.validateDescription(patch.getDescription());
            record.setDescription(patch.getDescription());
        }
        if (patch.getExpiresAt() != null) {
            record.setExpiresAt(patch.getExpiresAt());
        }
        if (patch.getActive() != null) {
            record.setActive(patch.getActive());
        }
        record.setUpdatedAt(clock.instant());

        try {
            urlStore.update(record);
        } catch (RecordNotFoundException e) {
            throw new NotFoundException(RESOURCE);
        } catch (DataAccessException e) {
            log.error("Failed to update URL {}", id, e);
            throw new InternalException("Failed to update URL", e);
        }
        evictTwice(id);
        log.info("Updated short URL {}", id);
        return toResponse(record);
    }

    public void delete(String id, String ownerKey) {
        UrlRecord record = loadRecord(id);
        checkOwner(record, ownerKey, "You don't have permission to delete this URL");

        try {
            urlStore.softDelete(id, clock.instant());
        } catch (RecordNotFoundException e) {
            throw new NotFoundException(RESOURCE);
        } catch (DataAccessException e) {
            log.error("Failed to delete URL {}", id, e);
            throw new InternalException("Failed to delete URL", e);
        }
        evictTwice(id);
        log.info("Deactivated short URL {}", id);
    }

    public UrlListResponse list(String ownerKey, UrlListOptions options) {
        UrlPage page;
        try {
            page = urlStore.list(ownerKey, options);
        } catch (DataAccessException e) {
            log.error("Failed to list URLs", e);
            throw new InternalException("Failed to retrieve URL list", e);
        }
        List<UrlResponse> urls = page.records().stream().map(this::toResponse).toList();
        return new UrlListResponse(urls, PaginationMeta.of(options.getPage(), options.getLimit(), page.totalCount()));
    }

    /** @return number of records deactivated */
    public int sweepExpired() {
        Instant now = clock.instant();
        int swept;
        List<String> expiredIds;
        try {
            expiredIds = urlStore.findExpiredIds(now);
            swept = urlStore.expireSweep(now);
        } catch (DataAccessException e) {
            log.error("Failed to cleanup expired URLs", e);
            throw new InternalException("Failed to cleanup expired URLs", e);
        }
        expiredIds.forEach(this::evictQuietly);
        log.info("Cleaned up {} expired URLs", swept);
        return swept;
    }

    private UrlRecord resolveRecord(String id) {
        Instant now = clock.instant();
        Optional<UrlRecord> cached = readCache(id);
        if (cached.isPresent()) {
            if (cached.get().isAccessible(now)) {
                metrics.cacheHit();
                log.debug("Cache HIT for {}", id);
                return cached.get();
            }
            evictQuietly(id);
        }
        metrics.cacheMiss();
        log.debug("Cache MISS for {}", id);

        UrlRecord record = loadRecord(id);
        if (!record.isActive()) {
            throw new NotFoundException(RESOURCE);
        }
        if (record.isExpired(now)) {
            throw new ExpiredException(RESOURCE);
        }
        cacheQuietly(record);
        return record;
    }

    private String allocateRandomId() {
        int length = properties.getId().getLength();
        int maxAttempts = properties.getId().getMaxAttempts();
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            String candidate = codec.generateRandom(length);
            if (!isTaken(candidate)) {
                return candidate;
            }
        }
        log.warn("No free {}-character ID after {} attempts; app.id.length should be increased", length, maxAttempts);
        throw new InternalException("Failed to generate unique ID after multiple attempts");
    }

    private String reserveCustomId(String customId) {
        validator.validateCustomId(customId);
        if (isTaken(customId)) {
            throw new ConflictException("Custom ID", customId);
        }
        return customId;
    }

    private boolean isTaken(String id) {
        try {
            return urlStore.exists(id);
        } catch (DataAccessException e) {
            log.error("Failed to check availability of ID {}", id, e);
            throw new InternalException("Failed to check ID availability", e);
        }
    }

    private UrlRecord loadRecord(String id) {
        Optional<UrlRecord> record;
        try {
            record = urlStore.getById(id);
        } catch (DataAccessException e) {
            log.error("Failed to get URL {} from database", id, e);
            throw new InternalException("Failed to retrieve URL", e);
        }
        return record.orElseThrow(() -> new NotFoundException(RESOURCE));
    }

    private static void checkOwner(UrlRecord record, String ownerKey, String message) {
        if (ownerKey == null || !ownerKey.equals(record.getOwnerKey())) {
            throw new UnauthorizedException(message);
        }
    }

    private Optional<UrlRecord> readCache(String id) {
        try {
            return urlCache.get(id);
        } catch (RuntimeException e) {
            log.warn("Cache read failed for URL {}, falling back to database", id, e);
            return Optional.empty();
        }
    }

    private void cacheQuietly(UrlRecord record) {
        try {
            urlCache.set(record.getId(), record, properties.getCache().getTtl());
        } catch (RuntimeException e) {
            log.warn("Failed to cache URL {}", record.getId(), e);
        }
    }

    private void evictQuietly(String id) {
        try {
            urlCache.delete(id);
        } catch (RuntimeException e) {
            log.warn("Failed to invalidate cache for URL {}", id, e);
        }
    }

    // A resolve that read the store before the mutation may write its stale copy back after the
    // first eviction; the delayed one removes it.
    private void evictTwice(String id) {
        evictQuietly(id);
        backgroundTasks.submitDelayed("cache-re-evict:" + id, properties.getCache().getReEvictDelay(),
                () -> evictQuietly(id));
    }

    private UrlResponse toResponse(UrlRecord record) {
        String base = properties.getBaseUrl().replaceAll("/+$", "");
        return UrlResponse.builder()
                .id(record.getId())
                .shortUrl(base + "/" + record.getId())
                .originalUrl(record.getOriginalUrl())
                .qrCodeUrl(base + "/api/v1/urls/" + record.getId() + "/qr")
                .description(record.getDescription())
                .expiresAt(record.getExpiresAt())
                .createdAt(record.getCreatedAt())
                .updatedAt(record.getUpdatedAt())
                .clickCount(record.getClickCount())
                .active(record.isActive())
                .lastAccessedAt(record.getLastAccessedAt())
                .build();
    }
}
