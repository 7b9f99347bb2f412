package com.cineplexx.rss.sync.service;

import com.cineplexx.rss.config.SyncProperties;
import com.cineplexx.rss.sync.model.JobKind;
import com.cineplexx.rss.sync.model.JobStatusRecord;
import com.cineplexx.rss.sync.model.RunStatus;
import com.cineplexx.rss.sync.util.AtomicFiles;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * Current run status, one record per job kind. Every update is written to the status file right
 * away.
 */
@Service
public class JobStatusService {
    private static final Logger log = LoggerFactory.getLogger(JobStatusService.class);

    private final ObjectMapper objectMapper;
    private final SyncProperties properties;
    private final Clock clock;
    private final String runId;
    private final Map<JobKind, Instant> lastSuccess = new EnumMap<>(JobKind.class);

    private RunStatus current;

    public JobStatusService(ObjectMapper objectMapper, SyncProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.runId = UUID.randomUUID().toString();
        this.current = new RunStatus(
            runId,
            clock.instant(),
            initialRecord(properties.getCatalogJob().isEnabled()),
            initialRecord(properties.getChannelJob().isEnabled())
        );
    }

    /** Picks up last successful completions from a status file left by a previous process. */
    @PostConstruct
    public synchronized void seedFromDisk() {
        Path path = statusPath();
        if (!Files.exists(path)) {
            return;
        }
        try {
            RunStatus previous = objectMapper.readValue(path.toFile(), RunStatus.class);
            for (JobKind kind : JobKind.values()) {
                JobStatusRecord record = previous.forKind(kind);
                if (record != null && record.isSuccessful() && record.finishedAt() != null) {
                    lastSuccess.put(kind, record.finishedAt());
                }
            }
        } catch (IOException e) {
            log.warn("Ignoring unreadable status file {}", path, e);
        }
    }

    public String runId() {
        return runId;
    }

    public synchronized RunStatus current() {
        return current;
    }

    public synchronized Map<JobKind, Instant> lastSuccessfulCompletions() {
        Map<JobKind, Instant> copy = new EnumMap<>(JobKind.class);
        copy.putAll(lastSuccess);
        return copy;
    }

    public synchronized void record(JobKind kind, JobStatusRecord record) {
        current = current.with(kind, record, clock.instant());
        if (record.isSuccessful() && record.finishedAt() != null) {
            lastSuccess.put(kind, record.finishedAt());
        }
        Path path = statusPath();
        try {
            Files.createDirectories(path.getParent());
            AtomicFiles.writeString(path, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(current));
        } catch (IOException e) {
            log.error("Failed to write status file {}", path, e);
        }
    }

    Path statusPath() {
        return Path.of(properties.getOutDir()).toAbsolutePath().resolve(properties.getIndex().getStatusFilename());
    }

    private static JobStatusRecord initialRecord(boolean enabled) {
        return enabled ? JobStatusRecord.pending() : JobStatusRecord.disabled();
    }
}
