package com.cineplexx.rss.sync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ScheduleCacheEntry(List<SessionSlot> sessions, String error, Instant fetchedAt) {
    public static final String NO_SESSIONS = "no_sessions";

    public ScheduleCacheEntry {
        sessions = sessions == null ? List.of() : List.copyOf(sessions);
    }
}
