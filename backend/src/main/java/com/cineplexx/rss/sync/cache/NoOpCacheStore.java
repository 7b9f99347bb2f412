package com.cineplexx.rss.sync.cache;

import java.util.Optional;

public class NoOpCacheStore implements CacheStore {

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        return Optional.empty();
    }

    @Override
    public void set(String key, Object value, long ttlSeconds) {
    }

    @Override
    public void close() {
    }
}
