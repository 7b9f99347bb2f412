package com.cineplexx.rss.sync.service;

import com.cineplexx.rss.sync.model.FeedLink;
import com.cineplexx.rss.sync.model.JobContext;
import com.cineplexx.rss.sync.model.JobKind;
import com.cineplexx.rss.sync.model.JobOutcome;

import java.time.Duration;
import java.util.List;

/** A periodically executed sync job. Implementations run to completion on the calling thread. */
public interface SyncJob {
    JobKind kind();

    boolean isEnabled();

    Duration interval();

    /** Feeds this job publishes, for the index and the status API. */
    List<FeedLink> feedLinks();

    JobOutcome run(JobContext context) throws Exception;
}
