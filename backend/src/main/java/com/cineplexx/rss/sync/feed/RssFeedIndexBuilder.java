package com.cineplexx.rss.sync.feed;

import com.cineplexx.rss.config.SyncProperties;
import com.cineplexx.rss.sync.model.FeedLink;
import com.cineplexx.rss.sync.model.JobKind;
import com.cineplexx.rss.sync.util.AtomicFiles;
import com.rometools.rome.feed.rss.Item;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Component
public class RssFeedIndexBuilder implements FeedIndexBuilder {
    private static final Logger log = LoggerFactory.getLogger(RssFeedIndexBuilder.class);

    private static final String INDEX_PAGE = "index.html";

    private final SyncProperties properties;

    public RssFeedIndexBuilder(SyncProperties properties) {
        this.properties = properties;
    }

    @Override
    public void rebuild(List<FeedLink> feeds, Map<JobKind, Instant> lastSuccess) throws IOException {
        Path path = Path.of(properties.getOutDir()).resolve(properties.getIndex().getFilename());
        AtomicFiles.writeString(path, build(feeds, lastSuccess));
        log.info("Rebuilt feed index {} with {} feeds", path, feeds.size());
    }

    public String build(List<FeedLink> feeds, Map<JobKind, Instant> lastSuccess) {
        List<Item> items = new ArrayList<>();
        for (FeedLink feed : feeds) {
            items.add(RssDocuments.item(
                feed.title(),
                feed.href(),
                RssDocuments.guid(feed.href(), false),
                lastSuccess.get(feed.kind()),
                feed.subtitle(),
                null
            ));
        }
        Instant lastBuild = lastSuccess.values().stream()
            .filter(Objects::nonNull)
            .max(Instant::compareTo)
            .orElse(null);
        String siteTitle = properties.getIndex().getSiteTitle();
        return RssDocuments.render(RssDocuments.channel(
            siteTitle,
            INDEX_PAGE,
            siteTitle + " feeds index",
            lastBuild,
            items
        ));
    }
}
