package com.cineplexx.rss.sync.state;

import com.cineplexx.rss.sync.feed.FeedIdentifiers;
import com.cineplexx.rss.sync.model.ChangeEvent;
import com.cineplexx.rss.sync.model.SnapshotRecord;
import com.cineplexx.rss.sync.model.SyncState;
import com.cineplexx.rss.sync.util.AtomicFiles;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class SnapshotStateStore {
    private static final Logger log = LoggerFactory.getLogger(SnapshotStateStore.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SnapshotStateStore(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public static Path statePath(Path outDir, String location) {
        return outDir.resolve("state_location_" + location + ".json");
    }

    /** Never throws: a missing or unreadable file yields an empty state. */
    public SyncState load(Path path) {
        String raw;
        try {
            raw = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            log.info("No state file at {}, starting from empty state", path);
            return SyncState.empty();
        } catch (IOException e) {
            log.warn("Failed to read state file {}, starting from empty state", path, e);
            return SyncState.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (IOException e) {
            log.warn("State file {} is not valid JSON, starting from empty state", path, e);
            return SyncState.empty();
        }
        if (root == null || !root.isObject()) {
            log.warn("State file {} has unexpected shape, starting from empty state", path);
            return SyncState.empty();
        }
        return new SyncState(readSnapshot(root.path("snapshot")), readEvents(root.path("events")));
    }

    public void save(Path path, SyncState state) throws IOException {
        PersistedState persisted = new PersistedState(state.getSnapshot(), state.getEvents());
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(persisted);
        AtomicFiles.writeString(path, json);
    }

    private Map<String, SnapshotRecord> readSnapshot(JsonNode node) {
        Map<String, SnapshotRecord> snapshot = new LinkedHashMap<>();
        if (!node.isObject()) {
            return snapshot;
        }
        Instant migratedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value == null || value.isNull()) {
                log.warn("Skipping empty snapshot record for {}", field.getKey());
                continue;
            }
            if (value.isTextual()) {
                // older files stored url -> title only
                snapshot.put(field.getKey(), new SnapshotRecord(value.asText(), migratedAt, migratedAt));
                continue;
            }
            try {
                SnapshotRecord record = objectMapper.treeToValue(value, SnapshotRecord.class);
                if (record == null) {
                    continue;
                }
                Instant firstSeen = record.firstSeen() == null ? migratedAt : record.firstSeen();
                Instant lastSeen = record.lastSeen() == null ? firstSeen : record.lastSeen();
                snapshot.put(field.getKey(), new SnapshotRecord(record.title(), firstSeen, lastSeen));
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Skipping unreadable snapshot record for {}", field.getKey(), e);
            }
        }
        return snapshot;
    }

    private List<ChangeEvent> readEvents(JsonNode node) {
        List<ChangeEvent> events = new ArrayList<>();
        if (!node.isArray()) {
            return events;
        }
        for (JsonNode item : node) {
            try {
                ChangeEvent event = objectMapper.treeToValue(item, ChangeEvent.class);
                if (event == null || event.kind() == null) {
                    continue;
                }
                if (event.legacyGuid() == null && item.path("type").isTextual() && item.path("ts").isTextual()) {
                    event = event.withLegacyGuid(FeedIdentifiers.legacyEventGuid(
                        item.path("type").asText(),
                        event.url(),
                        item.path("ts").asText()
                    ));
                }
                events.add(event);
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Skipping unreadable event {}", item, e);
            }
        }
        return events;
    }

    record PersistedState(Map<String, SnapshotRecord> snapshot, List<ChangeEvent> events) {}
}
