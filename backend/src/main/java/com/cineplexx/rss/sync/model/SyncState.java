package com.cineplexx.rss.sync.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of currently present catalog URLs plus the append-only event log (newest last).
 * Mutated in memory during one catalog cycle and persisted at its end.
 */
public class SyncState {
    private Map<String, SnapshotRecord> snapshot;
    private final List<ChangeEvent> events;

    public SyncState() {
        this(new LinkedHashMap<>(), new ArrayList<>());
    }

    public SyncState(Map<String, SnapshotRecord> snapshot, List<ChangeEvent> events) {
        this.snapshot = new LinkedHashMap<>(snapshot);
        this.events = new ArrayList<>(events);
    }

    public static SyncState empty() {
        return new SyncState();
    }

    public Map<String, SnapshotRecord> getSnapshot() {
        return snapshot;
    }

    public void replaceSnapshot(Map<String, SnapshotRecord> snapshot) {
        this.snapshot = new LinkedHashMap<>(snapshot);
    }

    public List<ChangeEvent> getEvents() {
        return events;
    }
}
