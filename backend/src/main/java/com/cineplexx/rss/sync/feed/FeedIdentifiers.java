package com.cineplexx.rss.sync.feed;

import com.cineplexx.rss.sync.model.ChangeEvent;
import com.cineplexx.rss.sync.util.HashUtils;

public final class FeedIdentifiers {
    private FeedIdentifiers() {
    }

    /**
     * Identifier of one detected change. Same (kind, url, detectedAt) always gives the same value;
     * a re-added title carries a new timestamp and therefore a new identifier.
     */
    public static String eventGuid(ChangeEvent event) {
        if (event.legacyGuid() != null && !event.legacyGuid().isBlank()) {
            return event.legacyGuid();
        }
        String kind = event.kind() == null ? "" : event.kind().wireName();
        String detectedAt = event.detectedAt() == null ? "" : event.detectedAt().toString();
        return "urn:sha256:" + HashUtils.sha256Hex("event:" + kind, event.url(), detectedAt);
    }

    /** Same hash over the raw {@code type} and {@code ts} strings of an older state file. */
    public static String legacyEventGuid(String type, String url, String ts) {
        return "urn:sha256:" + HashUtils.sha256Hex("event:" + type, url, ts);
    }
}
