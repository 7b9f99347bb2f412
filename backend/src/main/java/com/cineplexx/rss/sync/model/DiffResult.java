package com.cineplexx.rss.sync.model;

import java.util.List;

public record DiffResult(List<CatalogEntry> added, List<CatalogEntry> removed) {
    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }
}
