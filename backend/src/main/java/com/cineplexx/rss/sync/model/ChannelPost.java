package com.cineplexx.rss.sync.model;

import java.time.Instant;

public record ChannelPost(String postId, String permalink, String text, String html, Instant publishedAt) {}
