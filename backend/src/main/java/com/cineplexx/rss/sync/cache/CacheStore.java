package com.cineplexx.rss.sync.cache;

import java.util.Optional;

/**
 * TTL key/value store for fetched catalog data. Implementations never throw from
 * {@link #get}, {@link #set} or {@link #close}: a backend failure is a miss or a no-op.
 */
public interface CacheStore extends AutoCloseable {

    <T> Optional<T> get(String key, Class<T> type);

    void set(String key, Object value, long ttlSeconds);

    @Override
    void close();
}
