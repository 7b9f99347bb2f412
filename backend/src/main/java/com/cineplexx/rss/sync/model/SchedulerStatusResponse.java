package com.cineplexx.rss.sync.model;

import java.time.Instant;
import java.util.Map;

public record SchedulerStatusResponse(boolean running, Map<JobKind, Instant> nextRuns) {}
