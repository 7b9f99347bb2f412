package com.cineplexx.rss.sync.model;

import java.util.List;

public record ChannelFeed(String channel, String title, String description, String link, List<ChannelPost> posts) {}
