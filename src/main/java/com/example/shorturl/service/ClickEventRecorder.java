package com.example.shorturl.service;

import com.example.shorturl.config.ShortUrlProperties;
import com.example.shorturl.model.ClickContext;
import com.example.shorturl.model.ClickEvent;
import com.example.shorturl.repository.ClickEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class ClickEventRecorder {

    private static final int MAX_HEADER_LENGTH = 1024;

    private final ClickEventRepository clickEventRepository;
    private final ShortUrlProperties properties;

    public boolean isEnabled() {
        return properties.getClickEvents().isEnabled();
    }

    @Transactional
    public void record(String urlId, ClickContext context, Instant clickedAt) {
        ClickEvent event = new ClickEvent();
        event.setUrlId(urlId);
        event.setIpAddress(context.ipAddress());
        event.setUserAgent(truncate(context.userAgent()));
        event.setReferer(truncate(context.referer()));
        event.setClickedAt(clickedAt);
        clickEventRepository.save(event);
    }

    @Transactional
    public int purgeOlderThan(Instant cutoff) {
        int deleted = clickEventRepository.deleteOlderThan(cutoff);
        log.info("Purged {} click events older than {}", deleted, cutoff);
        return deleted;
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_HEADER_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_HEADER_LENGTH);
    }
}
