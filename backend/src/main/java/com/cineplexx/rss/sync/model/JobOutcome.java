package com.cineplexx.rss.sync.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record JobOutcome(JobStatus status, Map<String, Integer> counts, String error) {
    public JobOutcome {
        counts = counts == null ? Map.of() : new LinkedHashMap<>(counts);
    }

    public static JobOutcome ok(Map<String, Integer> counts) {
        return new JobOutcome(JobStatus.OK, counts, null);
    }

    public static JobOutcome error(String error) {
        return new JobOutcome(JobStatus.ERROR, Map.of(), error);
    }
}
