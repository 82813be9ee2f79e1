package com.example.shorturl.scheduling;

import com.example.shorturl.exception.ShortUrlException;
import com.example.shorturl.service.UrlService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ExpirySweepJob {

    private final UrlService urlService;

    @Scheduled(cron = "${app.sweep.cron:0 */10 * * * *}")
    public void run() {
        try {
            urlService.sweepExpired();
        } catch (ShortUrlException e) {
            // next run retries
            log.error("Expiry sweep failed", e);
        }
    }
}
