package com.cineplexx.rss.sync.feed;

import com.cineplexx.rss.config.SyncProperties;
import com.cineplexx.rss.sync.model.ChangeEvent;
import com.cineplexx.rss.sync.model.EventKind;
import com.cineplexx.rss.sync.model.Movie;
import com.cineplexx.rss.sync.model.SessionSlot;
import com.cineplexx.rss.sync.model.SnapshotRecord;
import com.cineplexx.rss.sync.util.AtomicFiles;
import com.rometools.rome.feed.rss.Item;
import org.jsoup.nodes.Entities;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Catalog feed: recent change events first (newest first), then one item per movie currently
 * listed. Movie items are keyed by canonical URL and dated by first sighting, so rebuilding without
 * content changes yields the same item identifiers and dates.
 */
@Component
public class CatalogFeedWriter {
    private final SyncProperties properties;

    public CatalogFeedWriter(SyncProperties properties) {
        this.properties = properties;
    }

    public void write(
        Path path,
        Instant now,
        List<ChangeEvent> events,
        List<Movie> movies,
        Map<String, SnapshotRecord> snapshot
    ) throws IOException {
        AtomicFiles.writeString(path, build(now, events, properties.getFeed().getEventsLimit(), movies, snapshot));
    }

    public String build(
        Instant now,
        List<ChangeEvent> events,
        int eventsLimit,
        List<Movie> movies,
        Map<String, SnapshotRecord> snapshot
    ) {
        SyncProperties.Feed feed = properties.getFeed();
        List<Item> items = new ArrayList<>();
        for (ChangeEvent event : recentEvents(events, eventsLimit)) {
            items.add(eventItem(event, feed.getLink(), now));
        }
        for (Movie movie : movies) {
            SnapshotRecord record = snapshot.get(movie.canonicalUrl());
            Instant published = record == null || record.firstSeen() == null ? now : record.firstSeen();
            items.add(movieItem(movie, published));
        }
        return RssDocuments.render(
            RssDocuments.channel(feed.getTitle(), feed.getLink(), feed.getDescription(), now, items)
        );
    }

    /** Last {@code limit} events of the log, newest first. */
    static List<ChangeEvent> recentEvents(List<ChangeEvent> events, int limit) {
        if (limit <= 0 || events.isEmpty()) {
            return List.of();
        }
        List<ChangeEvent> recent = new ArrayList<>(events.subList(Math.max(0, events.size() - limit), events.size()));
        Collections.reverse(recent);
        return recent;
    }

    private Item eventItem(ChangeEvent event, String feedLink, Instant now) {
        String prefix = event.kind() == EventKind.ADDED ? "Added: " : "Removed: ";
        String title = prefix + RssDocuments.nullToEmpty(event.title());
        String link = event.url() == null || event.url().isBlank() ? feedLink : event.url();
        String description = title + "\nlocation=" + event.location() + ", date=" + event.date() + "\n" + feedLink;
        return RssDocuments.item(
            title,
            link,
            RssDocuments.guid(FeedIdentifiers.eventGuid(event), false),
            event.detectedAt() == null ? now : event.detectedAt(),
            description,
            null
        );
    }

    private Item movieItem(Movie movie, Instant published) {
        String summary = movie.description().isBlank()
            ? "Now showing: " + movie.title()
            : movie.description();
        return RssDocuments.item(
            movie.title(),
            movie.canonicalUrl(),
            RssDocuments.guid(movie.canonicalUrl(), true),
            published,
            summary,
            movieHtml(movie)
        );
    }

    static String movieHtml(Movie movie) {
        StringBuilder html = new StringBuilder();
        if (!movie.description().isBlank()) {
            html.append("<p>").append(Entities.escape(movie.description())).append("</p>");
        }
        if (movie.sessions().isEmpty()) {
            return html.toString();
        }
        html.append("<ul>");
        for (SessionSlot slot : movie.sessions()) {
            html.append("<li>").append(Entities.escape(sessionLine(slot)));
            if (slot.purchaseUrl() != null && !slot.purchaseUrl().isBlank()) {
                html.append(" <a href=\"").append(Entities.escape(slot.purchaseUrl())).append("\">Tickets</a>");
            }
            html.append("</li>");
        }
        html.append("</ul>");
        return html.toString();
    }

    private static String sessionLine(SessionSlot slot) {
        List<String> parts = new ArrayList<>();
        String when = (slot.date() == null ? "" : slot.date() + " ") + RssDocuments.nullToEmpty(slot.time());
        parts.add(when.trim());
        for (String value : List.of(
            RssDocuments.nullToEmpty(slot.hall()),
            RssDocuments.nullToEmpty(slot.info()),
            RssDocuments.nullToEmpty(slot.venueName())
        )) {
            if (!value.isBlank()) {
                parts.add(value);
            }
        }
        return String.join(" · ", parts);
    }
}
