package com.cineplexx.rss.sync.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RunStatus(
    String runId,
    Instant updatedAt,
    JobStatusRecord cineplexxJob,
    JobStatusRecord telegramJob
) {
    public JobStatusRecord forKind(JobKind kind) {
        return kind == JobKind.CATALOG ? cineplexxJob : telegramJob;
    }

    public RunStatus with(JobKind kind, JobStatusRecord record, Instant now) {
        return kind == JobKind.CATALOG
            ? new RunStatus(runId, now, record, telegramJob)
            : new RunStatus(runId, now, cineplexxJob, record);
    }
}
