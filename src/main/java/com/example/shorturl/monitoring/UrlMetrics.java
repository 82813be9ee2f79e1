package com.example.shorturl.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class UrlMetrics {

    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter redirects;

    public UrlMetrics(MeterRegistry registry) {
        this.cacheHits = Counter.builder("shorturl.cache.hits")
                .description("Lookups answered from the cache")
                .register(registry);
        this.cacheMisses = Counter.builder("shorturl.cache.misses")
                .description("Lookups that fell through to the store")
                .register(registry);
        this.redirects = Counter.builder("shorturl.redirects")
                .description("Successful redirect resolutions")
                .register(registry);
    }

    public void cacheHit() {
        cacheHits.increment();
    }

    public void cacheMiss() {
        cacheMisses.increment();
    }

    public void redirect() {
        redirects.increment();
    }
}
