package com.example.shorturl.scheduling;

import com.example.shorturl.config.ShortUrlProperties;
import com.example.shorturl.service.ClickEventRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Drops raw click events older than {@code app.click-events.retention}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.click-events", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ClickEventPurgeJob {

    private final ClickEventRecorder recorder;
    private final ShortUrlProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${app.click-events.purge-cron:0 30 3 * * *}")
    public void run() {
        Instant cutoff = clock.instant().minus(properties.getClickEvents().getRetention());
        try {
            recorder.purgeOlderThan(cutoff);
        } catch (DataAccessException e) {
            log.error("Click event purge failed", e);
        }
    }
}
