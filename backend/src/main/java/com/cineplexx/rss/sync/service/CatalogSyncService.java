package com.cineplexx.rss.sync.service;

import com.cineplexx.rss.config.SyncProperties;
import com.cineplexx.rss.sync.feed.CatalogFeedWriter;
import com.cineplexx.rss.sync.model.DiffResult;
import com.cineplexx.rss.sync.model.FeedLink;
import com.cineplexx.rss.sync.model.JobContext;
import com.cineplexx.rss.sync.model.JobKind;
import com.cineplexx.rss.sync.model.JobOutcome;
import com.cineplexx.rss.sync.model.Movie;
import com.cineplexx.rss.sync.model.SyncState;
import com.cineplexx.rss.sync.state.SnapshotDiffEngine;
import com.cineplexx.rss.sync.state.SnapshotStateStore;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One catalog cycle: load state, fetch the listing, diff, append events, persist state, write the
 * feed. Steps run strictly in this order on the calling thread.
 */
@Service
public class CatalogSyncService implements SyncJob {
    private final CatalogFetchOrchestrator fetchOrchestrator;
    private final SnapshotStateStore stateStore;
    private final SnapshotDiffEngine diffEngine;
    private final CatalogFeedWriter feedWriter;
    private final SyncProperties properties;
    private final Clock clock;

    public CatalogSyncService(
        CatalogFetchOrchestrator fetchOrchestrator,
        SnapshotStateStore stateStore,
        SnapshotDiffEngine diffEngine,
        CatalogFeedWriter feedWriter,
        SyncProperties properties,
        Clock clock
    ) {
        this.fetchOrchestrator = fetchOrchestrator;
        this.stateStore = stateStore;
        this.diffEngine = diffEngine;
        this.feedWriter = feedWriter;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public JobKind kind() {
        return JobKind.CATALOG;
    }

    @Override
    public boolean isEnabled() {
        return properties.getCatalogJob().isEnabled();
    }

    @Override
    public Duration interval() {
        return Duration.ofSeconds(properties.getCatalogJob().getIntervalSeconds());
    }

    @Override
    public List<FeedLink> feedLinks() {
        SyncProperties.Feed feed = properties.getFeed();
        return List.of(new FeedLink(
            JobKind.CATALOG,
            feed.getTitle(),
            feed.getRssFilename(),
            "Location " + properties.getLocation()
        ));
    }

    @Override
    public JobOutcome run(JobContext context) throws IOException {
        LocalDate runDate = resolveRunDate();
        String location = properties.getLocation();
        Path outDir = Path.of(properties.getOutDir());
        Files.createDirectories(outDir);

        Path statePath = SnapshotStateStore.statePath(outDir, location);
        SyncState state = stateStore.load(statePath);
        List<Movie> movies = fetchOrchestrator.fetchCatalog(context, location, runDate);

        DiffResult diff = diffEngine.computeDiff(state.getSnapshot(), movies);
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        diffEngine.appendEvents(
            state,
            diff.added(),
            diff.removed(),
            now,
            location,
            runDate,
            properties.getFeed().getMaxEventsInState()
        );
        diffEngine.updateSnapshot(state, movies, now);
        stateStore.save(statePath, state);

        feedWriter.write(
            outDir.resolve(properties.getFeed().getRssFilename()),
            now,
            state.getEvents(),
            movies,
            state.getSnapshot()
        );

        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("movies", movies.size());
        counts.put("added", diff.added().size());
        counts.put("removed", diff.removed().size());
        counts.put("events", state.getEvents().size());
        context.log().info(
            "Run {} catalog sync wrote {} for location={} date={}: movies={} added={} removed={}",
            context.runId(),
            properties.getFeed().getRssFilename(),
            location,
            runDate,
            movies.size(),
            diff.added().size(),
            diff.removed().size()
        );
        return JobOutcome.ok(counts);
    }

    LocalDate resolveRunDate() {
        if (properties.getDateMode() == SyncProperties.DateMode.FIXED) {
            String fixed = properties.getFixedDate();
            if (fixed == null || fixed.isBlank()) {
                throw new CatalogConfigurationException("sync.fixed-date is required when sync.date-mode=FIXED");
            }
            try {
                return LocalDate.parse(fixed);
            } catch (DateTimeParseException e) {
                throw new CatalogConfigurationException("sync.fixed-date is not an ISO date: " + fixed, e);
            }
        }
        ZoneId zone;
        try {
            zone = ZoneId.of(properties.getTimezone());
        } catch (DateTimeException e) {
            throw new CatalogConfigurationException("Unknown timezone: " + properties.getTimezone(), e);
        }
        return LocalDate.ofInstant(clock.instant(), zone);
    }
}
