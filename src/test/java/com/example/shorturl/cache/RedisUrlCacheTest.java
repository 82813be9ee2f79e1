package com.example.shorturl.cache;

import com.example.shorturl.model.UrlRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisUrlCacheTest {

    private static final Instant NOW = Instant.parse("2024-02-02T08:00:00Z");

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private RedisOperations<String, String> operations;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    private RedisUrlCache cache;

    @BeforeEach
    void setUp() {
        cache = new RedisUrlCache(redisTemplate, objectMapper);
    }

    @Test
    void shouldStoreJsonUnderPrefixedKeyWithTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        UrlRecord record = UrlRecord.create("abc", "https://example.com", "d", NOW.plusSeconds(3600), "key-1", NOW);

        cache.set("abc", record, Duration.ofMinutes(5));

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("url:abc"), json.capture(), eq(Duration.ofMinutes(5)));
        assertThat(json.getValue())
                .contains("\"originalUrl\":\"https://example.com\"")
                .doesNotContain("newRecord");
    }

    @Test
    void shouldReadBackWhatItWrote() throws Exception {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        UrlRecord record = UrlRecord.create("abc", "https://example.com", null, null, "key-1", NOW);
        record.setClickCount(7);
        when(valueOperations.get("url:abc")).thenReturn(objectMapper.writeValueAsString(record));

        Optional<UrlRecord> cached = cache.get("abc");

        assertThat(cached).isPresent();
        assertThat(cached.get().getClickCount()).isEqualTo(7);
        assertThat(cached.get().getCreatedAt()).isEqualTo(NOW);
        assertThat(cached.get().isNew()).isFalse();
    }

    @Test
    void shouldTreatAbsentKeyAsMiss() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("url:missing")).thenReturn(null);

        assertThat(cache.get("missing")).isEmpty();
    }

    @Test
    void shouldDropUnreadableEntries() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("url:bad")).thenReturn("{not json");

        assertThat(cache.get("bad")).isEmpty();
        verify(redisTemplate).delete("url:bad");
    }

    @Test
    void shouldDeleteByPrefixedKey() {
        cache.delete("abc");

        verify(redisTemplate).delete("url:abc");
    }

    @Test
    void shouldIncrementCounterAndSetExpiryInOneTransaction() {
        // Given
        when(redisTemplate.execute(any(SessionCallback.class))).thenAnswer(invocation -> {
            SessionCallback<?> callback = invocation.getArgument(0);
            return callback.execute(operations);
        });
        when(operations.opsForValue()).thenReturn(valueOperations);
        when(operations.exec()).thenReturn(List.of(3L, true));

        // When
        long value = cache.incrementCounter("hits:abc", Duration.ofHours(1));

        // Then
        assertThat(value).isEqualTo(3L);
        InOrder inOrder = inOrder(operations, valueOperations);
        inOrder.verify(operations).multi();
        inOrder.verify(valueOperations).increment("hits:abc");
        inOrder.verify(operations).expire("hits:abc", Duration.ofHours(1));
        inOrder.verify(operations).exec();
        verify(redisTemplate, never()).expire(anyString(), any(Duration.class));
    }

    @Test
    void shouldReportZeroWhenTransactionIsDiscarded() {
        when(redisTemplate.execute(any(SessionCallback.class))).thenReturn(List.of());

        assertThat(cache.incrementCounter("hits:abc", Duration.ofHours(1))).isZero();
    }
}
