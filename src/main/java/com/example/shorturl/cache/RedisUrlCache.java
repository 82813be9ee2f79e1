package com.example.shorturl.cache;

import com.example.shorturl.model.UrlRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class RedisUrlCache implements UrlCache {

    static final String URL_PREFIX = "url:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void set(String id, UrlRecord record, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize URL " + id, e);
        }
        redisTemplate.opsForValue().set(key(id), json, ttl);
    }

    @Override
    public Optional<UrlRecord> get(String id) {
        String json = redisTemplate.opsForValue().get(key(id));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, UrlRecord.class));
        } catch (JsonProcessingException e) {
            log.warn("Dropping unreadable cache entry for {}", id, e);
            redisTemplate.delete(key(id));
            return Optional.empty();
        }
    }

    @Override
    public void delete(String id) {
        redisTemplate.delete(key(id));
    }

    @Override
    public long incrementCounter(String key, Duration ttl) {
        // INCR and EXPIRE in one MULTI/EXEC so a counter never outlives its window
        List<Object> results = redisTemplate.execute(new SessionCallback<List<Object>>() {
            @Override
            @SuppressWarnings("unchecked")
            public <K, V> List<Object> execute(RedisOperations<K, V> operations) {
                RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                ops.multi();
                ops.opsForValue().increment(key);
                ops.expire(key, ttl);
                return ops.exec();
            }
        });
        if (results == null || results.isEmpty() || !(results.get(0) instanceof Long)) {
            return 0;
        }
        return (Long) results.get(0);
    }

    private static String key(String id) {
        return URL_PREFIX + id;
    }
}
