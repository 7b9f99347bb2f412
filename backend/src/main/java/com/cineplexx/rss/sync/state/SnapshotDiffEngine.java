package com.cineplexx.rss.sync.state;

import com.cineplexx.rss.sync.model.CatalogEntry;
import com.cineplexx.rss.sync.model.ChangeEvent;
import com.cineplexx.rss.sync.model.DiffResult;
import com.cineplexx.rss.sync.model.EventKind;
import com.cineplexx.rss.sync.model.Movie;
import com.cineplexx.rss.sync.model.SnapshotRecord;
import com.cineplexx.rss.sync.model.SyncState;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Membership diff between the previous snapshot and the current listing, keyed on canonical URL
 * only. Titles never affect membership.
 */
@Component
public class SnapshotDiffEngine {

    public DiffResult computeDiff(Map<String, SnapshotRecord> previous, List<Movie> current) {
        Map<String, String> currentTitles = new TreeMap<>();
        for (Movie movie : current) {
            currentTitles.putIfAbsent(movie.canonicalUrl(), movie.title());
        }
        Map<String, SnapshotRecord> previousSorted = new TreeMap<>(previous);

        List<CatalogEntry> added = new ArrayList<>();
        for (Map.Entry<String, String> entry : currentTitles.entrySet()) {
            if (!previousSorted.containsKey(entry.getKey())) {
                added.add(new CatalogEntry(entry.getValue(), entry.getKey()));
            }
        }
        List<CatalogEntry> removed = new ArrayList<>();
        for (Map.Entry<String, SnapshotRecord> entry : previousSorted.entrySet()) {
            if (!currentTitles.containsKey(entry.getKey())) {
                String title = entry.getValue() == null ? "" : entry.getValue().title();
                removed.add(new CatalogEntry(title, entry.getKey()));
            }
        }
        return new DiffResult(List.copyOf(added), List.copyOf(removed));
    }

    /**
     * Appends one event per added entry, then one per removed entry, and evicts the oldest
     * events until at most {@code maxEvents} remain.
     */
    public void appendEvents(
        SyncState state,
        List<CatalogEntry> added,
        List<CatalogEntry> removed,
        Instant detectedAt,
        String location,
        LocalDate date,
        int maxEvents
    ) {
        List<ChangeEvent> events = state.getEvents();
        for (CatalogEntry entry : added) {
            events.add(new ChangeEvent(EventKind.ADDED, entry.title(), entry.canonicalUrl(), detectedAt, location, date));
        }
        for (CatalogEntry entry : removed) {
            events.add(new ChangeEvent(EventKind.REMOVED, entry.title(), entry.canonicalUrl(), detectedAt, location, date));
        }
        int limit = Math.max(0, maxEvents);
        if (events.size() > limit) {
            events.subList(0, events.size() - limit).clear();
        }
    }

    /**
     * Replaces the snapshot with the current URLs only. First-seen timestamps carry over for URLs
     * that were already present; URLs no longer listed are dropped.
     */
    public void updateSnapshot(SyncState state, List<Movie> current, Instant now) {
        Map<String, SnapshotRecord> previous = state.getSnapshot();
        Map<String, SnapshotRecord> next = new LinkedHashMap<>();
        for (Movie movie : current) {
            if (next.containsKey(movie.canonicalUrl())) {
                continue;
            }
            SnapshotRecord prior = previous.get(movie.canonicalUrl());
            Instant firstSeen = prior == null || prior.firstSeen() == null ? now : prior.firstSeen();
            next.put(movie.canonicalUrl(), new SnapshotRecord(movie.title(), firstSeen, now));
        }
        state.replaceSnapshot(next);
    }
}
