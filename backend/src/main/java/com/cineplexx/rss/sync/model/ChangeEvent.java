package com.cineplexx.rss.sync.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One detected addition or removal. {@code legacyGuid} is only set for events migrated from the
 * older state format and keeps the feed identifier subscribers already saw.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChangeEvent(
    @JsonAlias("type") EventKind kind,
    String title,
    String url,
    @JsonAlias("ts") Instant detectedAt,
    String location,
    LocalDate date,
    @JsonInclude(JsonInclude.Include.NON_NULL) String legacyGuid
) {
    @JsonCreator
    public ChangeEvent {
    }

    public ChangeEvent(EventKind kind, String title, String url, Instant detectedAt, String location, LocalDate date) {
        this(kind, title, url, detectedAt, location, date, null);
    }

    public ChangeEvent withLegacyGuid(String guid) {
        return new ChangeEvent(kind, title, url, detectedAt, location, date, guid);
    }
}
