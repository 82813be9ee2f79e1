package com.example.shorturl.monitoring;

import com.example.shorturl.repository.ClickEventRepository;
import com.example.shorturl.repository.UrlRecordRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class CustomMetrics {

    public CustomMetrics(MeterRegistry registry,
                         UrlRecordRepository urlRepository,
                         ClickEventRepository clickEventRepository) {

        Gauge.builder("app.urls.total", urlRepository::count)
             .description("Total number of shortened URLs")
             .register(registry);

        Gauge.builder("app.urls.active", urlRepository::countByActiveTrue)
             .description("Shortened URLs that are currently active")
             .register(registry);

        Gauge.builder("app.click_events.total", clickEventRepository::count)
             .description("Raw click events retained for analytics")
             .register(registry);
    }
}
