package com.cineplexx.rss.sync.service;

import com.cineplexx.rss.config.SyncProperties;
import com.cineplexx.rss.sync.cache.CacheKeys;
import com.cineplexx.rss.sync.cache.CacheStore;
import com.cineplexx.rss.sync.model.CatalogEntry;
import com.cineplexx.rss.sync.model.DescriptionCacheEntry;
import com.cineplexx.rss.sync.model.JobContext;
import com.cineplexx.rss.sync.model.Movie;
import com.cineplexx.rss.sync.model.ScheduleCacheEntry;
import com.cineplexx.rss.sync.model.SessionSlot;
import com.cineplexx.rss.sync.render.PageRenderer;
import com.cineplexx.rss.sync.render.RenderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds the current catalog listing: listing pages across the lookahead window, then one
 * description per title (bounded by the description pool) and one schedule per title and date
 * (bounded by the schedule pool). Any single fetch failure degrades to an empty value.
 */
@Service
public class CatalogFetchOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(CatalogFetchOrchestrator.class);
    private static final String CACHE_SOURCE = "cineplexx";

    static final Comparator<Movie> LISTING_ORDER = Comparator
        .comparing((Movie movie) -> movie.title().toLowerCase(Locale.ROOT))
        .thenComparing(Movie::canonicalUrl);

    private final PageRenderer pageRenderer;
    private final CacheStore cacheStore;
    private final ExecutorService descriptionExecutor;
    private final ExecutorService scheduleExecutor;
    private final SyncProperties properties;
    private final Clock clock;

    public CatalogFetchOrchestrator(
        PageRenderer pageRenderer,
        CacheStore cacheStore,
        @Qualifier("descriptionExecutor") ExecutorService descriptionExecutor,
        @Qualifier("scheduleExecutor") ExecutorService scheduleExecutor,
        SyncProperties properties,
        Clock clock
    ) {
        this.pageRenderer = pageRenderer;
        this.cacheStore = cacheStore;
        this.descriptionExecutor = descriptionExecutor;
        this.scheduleExecutor = scheduleExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public List<Movie> fetchCatalog(JobContext context, String location, LocalDate runDate) {
        Instant startedAt = clock.instant();
        boolean scheduleEnabled = properties.getSchedule().isEnabled();
        List<LocalDate> window = scheduleEnabled
            ? lookaheadWindow(runDate, properties.getSchedule().getMaxDaysAhead())
            : List.of(runDate);
        FetchStats stats = new FetchStats();

        List<CatalogEntry> entries = collectEntries(location, window);
        context.log().info(
            "Run {} listing collected: location={} dates={} titles={}",
            context.runId(),
            location,
            window.size(),
            entries.size()
        );

        List<PendingMovie> pending = new ArrayList<>(entries.size());
        for (CatalogEntry entry : entries) {
            CompletableFuture<String> description = CompletableFuture.supplyAsync(
                () -> describe(entry, stats),
                descriptionExecutor
            );
            Map<LocalDate, CompletableFuture<List<SessionSlot>>> schedule = new LinkedHashMap<>();
            if (scheduleEnabled) {
                for (LocalDate date : window) {
                    schedule.put(date, CompletableFuture.supplyAsync(
                        () -> sessionsFor(entry.canonicalUrl(), location, date, stats),
                        scheduleExecutor
                    ));
                }
            }
            pending.add(new PendingMovie(entry, description, schedule));
        }

        List<Movie> movies = new ArrayList<>(pending.size());
        for (PendingMovie item : pending) {
            String description = joinOrDefault(item.description(), "", item.entry().canonicalUrl());
            List<SessionSlot> sessions = assembleSessions(item);
            movies.add(new Movie(item.entry().title(), item.entry().canonicalUrl(), description, sessions));
        }

        List<Movie> result = movies.stream()
            .filter(Movie::isPublishable)
            .sorted(LISTING_ORDER)
            .toList();
        context.log().info(
            "Run {} catalog fetch finished: durationMs={} movies={} descriptionCacheHits={} descriptionCacheMisses={} "
                + "descriptionPagesFetched={} scheduleEnabled={} scheduleCacheHits={} scheduleCacheMisses={} "
                + "datesProbed={} datesWithSessions={} sessionsFound={}",
            context.runId(),
            Duration.between(startedAt, clock.instant()).toMillis(),
            result.size(),
            stats.descriptionCacheHits.get(),
            stats.descriptionCacheMisses.get(),
            stats.descriptionPagesFetched.get(),
            scheduleEnabled,
            stats.scheduleCacheHits.get(),
            stats.scheduleCacheMisses.get(),
            stats.datesProbed.get(),
            stats.datesWithSessions.get(),
            stats.sessionsFound.get()
        );
        return result;
    }

    static List<LocalDate> lookaheadWindow(LocalDate runDate, int daysAhead) {
        List<LocalDate> dates = new ArrayList<>(daysAhead + 1);
        for (int offset = 0; offset <= daysAhead; offset++) {
            dates.add(runDate.plusDays(offset));
        }
        return dates;
    }

    private List<CatalogEntry> collectEntries(String location, List<LocalDate> window) {
        Map<String, CatalogEntry> merged = new LinkedHashMap<>();
        for (LocalDate date : window) {
            RenderResult<List<CatalogEntry>> listing = pageRenderer.renderListing(location, date);
            if (!listing.isSuccessful()) {
                log.warn(
                    "Listing fetch failed for location={} date={}: {} {}",
                    location,
                    date,
                    listing.errorCode(),
                    listing.errorMessage()
                );
            }
            for (CatalogEntry entry : listing.valueOr(List.of())) {
                if (entry == null || entry.canonicalUrl() == null || entry.canonicalUrl().isBlank()) {
                    continue;
                }
                CatalogEntry existing = merged.get(entry.canonicalUrl());
                if (existing == null || (isBlank(existing.title()) && !isBlank(entry.title()))) {
                    merged.put(entry.canonicalUrl(), entry);
                }
            }
        }
        return new ArrayList<>(merged.values());
    }

    private String describe(CatalogEntry entry, FetchStats stats) {
        String url = entry.canonicalUrl();
        String key = CacheKeys.description(url);
        Optional<DescriptionCacheEntry> cached = cacheStore.get(key, DescriptionCacheEntry.class);
        if (cached.isPresent() && (cached.get().hasDescription() || cached.get().isNotFoundMarker())) {
            stats.descriptionCacheHits.incrementAndGet();
            return cached.get().hasDescription() ? cached.get().description() : "";
        }

        stats.descriptionCacheMisses.incrementAndGet();
        stats.descriptionPagesFetched.incrementAndGet();
        RenderResult<String> rendered = pageRenderer.renderDescription(url);
        if (!rendered.isSuccessful()) {
            log.warn("Description fetch failed for {}: {} {}", url, rendered.errorCode(), rendered.errorMessage());
        }
        String description = rendered.valueOr("");
        Instant now = clock.instant();
        if (!description.isBlank()) {
            cacheStore.set(
                key,
                new DescriptionCacheEntry(entry.title(), description, null, now, CACHE_SOURCE),
                properties.getCache().getDescriptionTtlSeconds()
            );
        } else {
            log.warn("Movie description missing for {}", url);
            cacheStore.set(
                key,
                new DescriptionCacheEntry(entry.title(), null, DescriptionCacheEntry.NOT_FOUND, now, CACHE_SOURCE),
                properties.getCache().getDescriptionNegativeTtlSeconds()
            );
        }
        return description;
    }

    private List<SessionSlot> sessionsFor(String url, String location, LocalDate date, FetchStats stats) {
        String key = CacheKeys.schedule(url, location, date);
        Optional<ScheduleCacheEntry> cached = cacheStore.get(key, ScheduleCacheEntry.class);
        if (cached.isPresent()) {
            stats.scheduleCacheHits.incrementAndGet();
            List<SessionSlot> sessions = stampDate(cached.get().sessions(), date);
            recordSessions(stats, sessions);
            return sessions;
        }

        stats.scheduleCacheMisses.incrementAndGet();
        stats.datesProbed.incrementAndGet();
        RenderResult<List<SessionSlot>> rendered = pageRenderer.renderSchedule(url, date, location);
        if (!rendered.isSuccessful()) {
            log.warn(
                "Schedule fetch failed for {} date={}: {} {}",
                url,
                date,
                rendered.errorCode(),
                rendered.errorMessage()
            );
        }
        List<SessionSlot> sessions = stampDate(rendered.valueOr(List.of()), date);
        recordSessions(stats, sessions);
        Instant now = clock.instant();
        if (!sessions.isEmpty()) {
            cacheStore.set(
                key,
                new ScheduleCacheEntry(sessions, null, now),
                properties.getCache().getScheduleTtlSeconds()
            );
        } else {
            cacheStore.set(
                key,
                new ScheduleCacheEntry(List.of(), ScheduleCacheEntry.NO_SESSIONS, now),
                properties.getCache().getScheduleNegativeTtlSeconds()
            );
        }
        return sessions;
    }

    /**
     * Walks the window in date order, stopping once the per-movie session cap or distinct-date cap
     * is reached. Dates after the stop point are cancelled; ones already running are ignored.
     */
    private List<SessionSlot> assembleSessions(PendingMovie item) {
        int maxSessions = properties.getSchedule().getMaxSessionsPerMovie();
        int maxDates = properties.getSchedule().getMaxDatesPerMovie();
        List<SessionSlot> sessions = new ArrayList<>();
        Set<LocalDate> datesUsed = new HashSet<>();
        boolean stopped = false;
        for (Map.Entry<LocalDate, CompletableFuture<List<SessionSlot>>> dated : item.schedule().entrySet()) {
            if (stopped) {
                dated.getValue().cancel(false);
                continue;
            }
            if (sessions.size() >= maxSessions) {
                stopped = true;
                dated.getValue().cancel(false);
                continue;
            }
            List<SessionSlot> daySessions = joinOrDefault(dated.getValue(), List.of(), item.entry().canonicalUrl());
            if (daySessions.isEmpty()) {
                continue;
            }
            if (!sessions.isEmpty() && datesUsed.size() >= maxDates) {
                stopped = true;
                continue;
            }
            for (SessionSlot slot : daySessions) {
                if (sessions.size() >= maxSessions) {
                    break;
                }
                sessions.add(slot);
                datesUsed.add(dated.getKey());
            }
        }
        return sessions;
    }

    private <T> T joinOrDefault(CompletableFuture<T> future, T fallback, String url) {
        try {
            T value = future.join();
            return value == null ? fallback : value;
        } catch (CompletionException e) {
            log.warn("Fetch task failed for {}", url, e.getCause() == null ? e : e.getCause());
            return fallback;
        }
    }

    private static List<SessionSlot> stampDate(List<SessionSlot> sessions, LocalDate date) {
        List<SessionSlot> stamped = new ArrayList<>(sessions.size());
        for (SessionSlot slot : sessions) {
            if (slot != null) {
                stamped.add(slot.withDate(date));
            }
        }
        return stamped;
    }

    private static void recordSessions(FetchStats stats, List<SessionSlot> sessions) {
        if (!sessions.isEmpty()) {
            stats.datesWithSessions.incrementAndGet();
            stats.sessionsFound.addAndGet(sessions.size());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record PendingMovie(
        CatalogEntry entry,
        CompletableFuture<String> description,
        Map<LocalDate, CompletableFuture<List<SessionSlot>>> schedule
    ) {}

    private static final class FetchStats {
        private final AtomicInteger descriptionCacheHits = new AtomicInteger();
        private final AtomicInteger descriptionCacheMisses = new AtomicInteger();
        private final AtomicInteger descriptionPagesFetched = new AtomicInteger();
        private final AtomicInteger scheduleCacheHits = new AtomicInteger();
        private final AtomicInteger scheduleCacheMisses = new AtomicInteger();
        private final AtomicInteger datesProbed = new AtomicInteger();
        private final AtomicInteger datesWithSessions = new AtomicInteger();
        private final AtomicInteger sessionsFound = new AtomicInteger();
    }
}
