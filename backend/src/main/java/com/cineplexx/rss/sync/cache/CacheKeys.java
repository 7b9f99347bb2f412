package com.cineplexx.rss.sync.cache;

import com.cineplexx.rss.sync.util.HashUtils;

import java.time.LocalDate;

/**
 * Fixed-length cache keys. Each entity kind hashes its own namespace into the digest and also
 * carries a distinct key prefix, so description and schedule entries can never collide.
 */
public final class CacheKeys {
    static final String DESCRIPTION_KIND = "film";
    static final String SCHEDULE_KIND = "sessions";
    private static final String PREFIX = "cineplexx:";

    private CacheKeys() {
    }

    public static String description(String canonicalUrl) {
        return PREFIX + DESCRIPTION_KIND + ":" + HashUtils.sha256Hex(DESCRIPTION_KIND, canonicalUrl);
    }

    public static String schedule(String canonicalUrl, String location, LocalDate date) {
        return PREFIX + SCHEDULE_KIND + ":"
            + HashUtils.sha256Hex(SCHEDULE_KIND, canonicalUrl, location, date.toString());
    }
}
