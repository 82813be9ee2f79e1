package com.example.shorturl.service;

import com.example.shorturl.codec.Base62Codec;
import com.example.shorturl.config.ShortUrlProperties;
import com.example.shorturl.dto.CreateUrlRequest;
import com.example.shorturl.dto.UrlResponse;
import com.example.shorturl.exception.ConflictException;
import com.example.shorturl.monitoring.UrlMetrics;
import com.example.shorturl.support.InMemoryUrlCache;
import com.example.shorturl.support.InMemoryUrlStore;
import com.example.shorturl.task.BackgroundTasks;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class UrlServiceConcurrencyTest {

    private static final int THREADS = 16;

    private ExecutorService callers;
    private ExecutorService background;
    private InMemoryUrlStore store;
    private UrlService service;

    @BeforeEach
    void setUp() {
        callers = Executors.newFixedThreadPool(THREADS);
        background = Executors.newSingleThreadExecutor();
        store = new InMemoryUrlStore();
        ShortUrlProperties properties = new ShortUrlProperties();
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        service = new UrlService(store, new InMemoryUrlCache(), new Base62Codec(), new UrlValidator(properties),
                new BackgroundTasks(background, registry), mock(ClickEventRecorder.class), new UrlMetrics(registry),
                properties, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        callers.shutdownNow();
        background.shutdownNow();
        callers.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void shouldLetExactlyOneCallerClaimACustomId() throws Exception {
        // Given
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger conflicts = new AtomicInteger();
        List<Future<UrlResponse>> results = new ArrayList<>();

        // When
        for (int i = 0; i < THREADS; i++) {
            int caller = i;
            results.add(callers.submit(() -> {
                start.await();
                try {
                    return service.create(CreateUrlRequest.builder()
                            .originalUrl("https://example.com/" + caller)
                            .customId("contested")
                            .build(), "owner-" + caller);
                } catch (ConflictException e) {
                    conflicts.incrementAndGet();
                    return null;
                }
            }));
        }
        start.countDown();

        // Then
        int winners = 0;
        for (Future<UrlResponse> result : results) {
            if (result.get(10, TimeUnit.SECONDS) != null) {
                winners++;
            }
        }
        assertThat(winners).isEqualTo(1);
        assertThat(conflicts.get()).isEqualTo(THREADS - 1);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void shouldHandOutDistinctRandomIdsUnderLoad() throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        Set<String> ids = ConcurrentHashMap.newKeySet();
        List<Callable<Void>> tasks = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            tasks.add(() -> {
                start.await();
                for (int n = 0; n < 50; n++) {
                    ids.add(service.create(CreateUrlRequest.builder()
                            .originalUrl("https://example.com/" + n)
                            .build(), "owner").getId());
                }
                return null;
            });
        }

        List<Future<Void>> futures = new ArrayList<>();
        for (Callable<Void> task : tasks) {
            futures.add(callers.submit(task));
        }
        start.countDown();
        for (Future<Void> future : futures) {
            try {
                future.get(30, TimeUnit.SECONDS);
            } catch (ExecutionException e) {
                throw new AssertionError("create failed", e.getCause());
            }
        }

        assertThat(ids).hasSize(THREADS * 50);
        assertThat(store.size()).isEqualTo(THREADS * 50);
    }
}
