package com.cineplexx.rss.sync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DescriptionCacheEntry(
    String title,
    String description,
    String error,
    Instant fetchedAt,
    String source
) {
    public static final String NOT_FOUND = "not_found";

    public boolean hasDescription() {
        return description != null && !description.isBlank();
    }

    @JsonIgnore
    public boolean isNotFoundMarker() {
        return error != null && !error.isBlank();
    }
}
