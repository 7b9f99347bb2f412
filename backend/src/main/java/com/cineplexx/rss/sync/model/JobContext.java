package com.cineplexx.rss.sync.model;

import org.slf4j.Logger;

import java.time.Instant;

/** Per-execution context handed to a job: which run and cycle it belongs to and where to log. */
public record JobContext(String runId, JobKind kind, long cycle, Instant startedAt, Logger log) {}
