package com.cineplexx.rss.sync.model;

public enum JobKind {
    CATALOG("cineplexx"),
    CHANNEL("telegram");

    private final String label;

    JobKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
