package com.example.shorturl.store;

import com.example.shorturl.model.SortOrder;
import com.example.shorturl.model.UrlListOptions;
import com.example.shorturl.model.UrlRecord;
import com.example.shorturl.repository.UrlRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaUrlStore implements UrlStore {

    private final UrlRecordRepository repository;

    @Override
    public void create(UrlRecord record) {
        record.setNewRecord(true);
        try {
            repository.saveAndFlush(record);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateIdException(record.getId(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UrlRecord> getById(String id) {
        return repository.findById(id);
    }

    @Override
    @Transactional
    public void update(UrlRecord record) {
        int updated = repository.updateDetails(record.getId(), record.getOriginalUrl(), record.getDescription(),
                record.getExpiresAt(), record.isActive(), record.getUpdatedAt());
        if (updated == 0) {
            throw new RecordNotFoundException(record.getId());
        }
    }

    @Override
    @Transactional
    public void softDelete(String id, Instant now) {
        if (repository.softDelete(id, now) == 0) {
            throw new RecordNotFoundException(id);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public UrlPage list(String ownerKey, UrlListOptions options) {
        Sort.Direction direction = options.getOrder() == SortOrder.ASC ? Sort.Direction.ASC : Sort.Direction.DESC;
        Sort sort = Sort.by(new Sort.Order(direction, options.getSort().property()).nullsLast())
                .and(Sort.by(Sort.Direction.ASC, "id"));
        PageRequest pageRequest = PageRequest.of(options.getPage() - 1, options.getLimit(), sort);

        Page<UrlRecord> page = options.getActive() == null
                ? repository.findByOwnerKey(ownerKey, pageRequest)
                : repository.findByOwnerKeyAndActive(ownerKey, options.getActive(), pageRequest);
        return new UrlPage(page.getContent(), page.getTotalElements());
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(String id) {
        return repository.existsById(id);
    }

    @Override
    @Transactional
    public void incrementClick(String id, Instant now) {
        if (repository.incrementClickCount(id, now) == 0) {
            throw new RecordNotFoundException(id);
        }
    }

    @Override
    @Transactional
    public void touchLastAccessed(String id, Instant now) {
        if (repository.touchLastAccessed(id, now) == 0) {
            throw new RecordNotFoundException(id);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> findExpiredIds(Instant now) {
        return repository.findExpiredIds(now);
    }

    @Override
    @Transactional
    public int expireSweep(Instant now) {
        int affected = repository.deactivateExpired(now);
        log.debug("Deactivated {} expired URLs as of {}", affected, now);
        return affected;
    }
}
