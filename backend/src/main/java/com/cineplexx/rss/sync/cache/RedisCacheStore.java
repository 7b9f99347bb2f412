package com.cineplexx.rss.sync.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/** Redis-backed cache storing JSON values. Fails open on every backend or mapping error. */
public class RedisCacheStore implements CacheStore {
    private static final Logger log = LoggerFactory.getLogger(RedisCacheStore.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public RedisCacheStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        try {
            String raw = redisTemplate.opsForValue().get(key);
            if (raw == null) {
                return Optional.empty();
            }
            return Optional.ofNullable(objectMapper.readValue(raw, type));
        } catch (Exception e) {
            log.warn("Cache get failed for key {}", key, e);
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, Object value, long ttlSeconds) {
        try {
            String payload = objectMapper.writeValueAsString(value);
            redisTemplate.opsForValue().set(key, payload, Duration.ofSeconds(Math.max(1, ttlSeconds)));
        } catch (Exception e) {
            log.warn("Cache set failed for key {}", key, e);
        }
    }

    @Override
    public void close() {
        // connection factory lifecycle belongs to the Spring context
        log.debug("Redis cache store closed");
    }
}
