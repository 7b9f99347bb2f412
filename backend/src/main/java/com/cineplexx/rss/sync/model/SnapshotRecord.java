package com.cineplexx.rss.sync.model;

import java.time.Instant;

public record SnapshotRecord(String title, Instant firstSeen, Instant lastSeen) {}
