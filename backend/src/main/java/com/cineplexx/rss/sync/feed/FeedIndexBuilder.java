package com.cineplexx.rss.sync.feed;

import com.cineplexx.rss.sync.model.FeedLink;
import com.cineplexx.rss.sync.model.JobKind;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Publishes the feed-of-feeds listing every generated feed. */
public interface FeedIndexBuilder {
    /**
     * @param lastSuccess last successful completion per job kind; kinds that never succeeded are absent
     */
    void rebuild(List<FeedLink> feeds, Map<JobKind, Instant> lastSuccess) throws IOException;
}
