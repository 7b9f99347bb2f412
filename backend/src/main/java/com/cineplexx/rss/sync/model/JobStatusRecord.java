package com.cineplexx.rss.sync.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JobStatusRecord(
    boolean enabled,
    JobStatus status,
    Instant startedAt,
    Instant finishedAt,
    Double durationSeconds,
    Map<String, Integer> counts,
    String error
) {
    public JobStatusRecord {
        counts = counts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return status != null && status.isSuccessful();
    }

    public static JobStatusRecord pending() {
        return new JobStatusRecord(true, null, null, null, null, Map.of(), null);
    }

    public static JobStatusRecord disabled() {
        return new JobStatusRecord(false, null, null, null, null, Map.of(), null);
    }
}
