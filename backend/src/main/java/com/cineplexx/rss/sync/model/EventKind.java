package com.cineplexx.rss.sync.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EventKind {
    ADDED("added"),
    REMOVED("removed");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Accepts the current names as well as the short {@code add}/{@code remove} forms of older state files. */
    @JsonCreator
    public static EventKind fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Event kind is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "added", "add" -> ADDED;
            case "removed", "remove" -> REMOVED;
            default -> throw new IllegalArgumentException("Unknown event kind: " + value);
        };
    }
}
