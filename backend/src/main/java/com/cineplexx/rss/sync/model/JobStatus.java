package com.cineplexx.rss.sync.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobStatus {
    OK,
    PARTIAL,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isSuccessful() {
        return this != ERROR;
    }
}
