package com.cineplexx.rss.sync.model;

public record FeedLink(JobKind kind, String title, String href, String subtitle) {}
