package com.cineplexx.rss.sync.model;

public record CatalogEntry(String title, String canonicalUrl) {}
