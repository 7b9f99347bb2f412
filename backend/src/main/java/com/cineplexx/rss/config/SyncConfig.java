package com.cineplexx.rss.config;

import com.cineplexx.rss.sync.cache.CacheStore;
import com.cineplexx.rss.sync.cache.NoOpCacheStore;
import com.cineplexx.rss.sync.cache.RedisCacheStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SyncConfig {
    private static final Logger log = LoggerFactory.getLogger(SyncConfig.class);

    @Bean(name = "descriptionExecutor", destroyMethod = "shutdown")
    public ExecutorService descriptionExecutor(SyncProperties properties) {
        return Executors.newFixedThreadPool(properties.getFetch().getDescriptionConcurrency());
    }

    @Bean(name = "scheduleExecutor", destroyMethod = "shutdown")
    public ExecutorService scheduleExecutor(SyncProperties properties) {
        return Executors.newFixedThreadPool(properties.getFetch().getScheduleConcurrency());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Redis when enabled and reachable at startup, otherwise a no-op store. */
    @Bean(destroyMethod = "close")
    public CacheStore cacheStore(
        SyncProperties properties,
        ObjectProvider<StringRedisTemplate> redisTemplate,
        ObjectMapper objectMapper
    ) {
        if (!properties.getCache().isEnabled()) {
            log.info("Cache disabled");
            return new NoOpCacheStore();
        }
        StringRedisTemplate template = redisTemplate.getIfAvailable();
        if (template == null) {
            log.warn("Cache enabled but no Redis template is configured; caching disabled");
            return new NoOpCacheStore();
        }
        try {
            String pong = template.execute((RedisCallback<String>) connection -> connection.ping());
            log.info("Redis cache connected ({})", pong);
            return new RedisCacheStore(template, objectMapper);
        } catch (Exception e) {
            log.warn("Redis unavailable; caching disabled", e);
            return new NoOpCacheStore();
        }
    }
}
