package com.cineplexx.rss.sync.service;

import com.cineplexx.rss.sync.feed.FeedIndexBuilder;
import com.cineplexx.rss.sync.model.FeedLink;
import com.cineplexx.rss.sync.model.JobContext;
import com.cineplexx.rss.sync.model.JobOutcome;
import com.cineplexx.rss.sync.model.JobStatusRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Job boundary shared by the scheduler loop and the one-shot CLI: runs a job, turns any exception
 * into an error record, persists the record, and rebuilds the feed index on request.
 */
@Component
public class SyncJobRunner {
    private static final Logger log = LoggerFactory.getLogger(SyncJobRunner.class);
    private static final String JOB_LOGGER_PREFIX = "com.cineplexx.rss.sync.job.";
    private static final int MAX_ERROR_LENGTH = 500;

    private final List<SyncJob> jobs;
    private final JobStatusService statusService;
    private final FeedIndexBuilder indexBuilder;
    private final Clock clock;

    public SyncJobRunner(
        List<SyncJob> jobs,
        JobStatusService statusService,
        FeedIndexBuilder indexBuilder,
        Clock clock
    ) {
        this.jobs = jobs.stream().sorted(Comparator.comparing(SyncJob::kind)).toList();
        this.statusService = statusService;
        this.indexBuilder = indexBuilder;
        this.clock = clock;
    }

    /** Jobs in execution order: catalog first, then channels. */
    public List<SyncJob> jobs() {
        return jobs;
    }

    public JobStatusRecord execute(SyncJob job, long cycle) {
        Instant startedAt = clock.instant();
        JobContext context = new JobContext(
            statusService.runId(),
            job.kind(),
            cycle,
            startedAt,
            LoggerFactory.getLogger(JOB_LOGGER_PREFIX + job.kind().label())
        );
        log.info("Run {} starting {} job (cycle {})", context.runId(), job.kind().label(), cycle);

        JobOutcome outcome;
        try {
            outcome = job.run(context);
        } catch (Exception e) {
            log.error("Run {} {} job failed", context.runId(), job.kind().label(), e);
            outcome = JobOutcome.error(describe(e));
        }

        Instant finishedAt = clock.instant();
        JobStatusRecord record = new JobStatusRecord(
            true,
            outcome.status(),
            startedAt,
            finishedAt,
            Duration.between(startedAt, finishedAt).toMillis() / 1000.0,
            outcome.counts(),
            outcome.error()
        );
        statusService.record(job.kind(), record);
        log.info(
            "Run {} {} job finished with status {} in {}s counts={}",
            context.runId(),
            job.kind().label(),
            record.status().wireName(),
            record.durationSeconds(),
            record.counts()
        );
        return record;
    }

    /** Feeds of every enabled job, in job order. */
    public List<FeedLink> feedLinks() {
        List<FeedLink> links = new ArrayList<>();
        for (SyncJob job : jobs) {
            if (job.isEnabled()) {
                links.addAll(job.feedLinks());
            }
        }
        return links;
    }

    public void rebuildIndex() {
        try {
            indexBuilder.rebuild(feedLinks(), statusService.lastSuccessfulCompletions());
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to rebuild feed index", e);
        }
    }

    private static String describe(Exception e) {
        String message = e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage());
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
