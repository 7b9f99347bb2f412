package com.cineplexx.rss.sync.model;

import java.util.List;

public record Movie(String title, String canonicalUrl, String description, List<SessionSlot> sessions) {
    public Movie {
        description = description == null ? "" : description;
        sessions = sessions == null ? List.of() : List.copyOf(sessions);
    }

    public boolean isPublishable() {
        return title != null && !title.isBlank() && canonicalUrl != null && !canonicalUrl.isBlank();
    }
}
