package com.cineplexx.rss.sync.service;

import com.cineplexx.rss.config.SyncProperties;
import com.cineplexx.rss.sync.model.JobKind;
import com.cineplexx.rss.sync.model.JobStatusRecord;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single coordinating loop for both jobs. Each enabled job has its own next-run instant; due jobs
 * run one after another, and the next run is scheduled relative to when the job finished.
 */
@Service
public class SyncSchedulerService {
    private static final Logger log = LoggerFactory.getLogger(SyncSchedulerService.class);

    private final SyncJobRunner jobRunner;
    private final SyncProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong cycles = new AtomicLong();
    private final Object lifecycleLock = new Object();
    private final Map<JobKind, Instant> nextRuns = new EnumMap<>(JobKind.class);
    private volatile Map<JobKind, Instant> publishedNextRuns = Map.of();

    private ExecutorService executor;

    public SyncSchedulerService(SyncJobRunner jobRunner, SyncProperties properties, Clock clock) {
        this.jobRunner = jobRunner;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getScheduler().isEnabled() && !properties.getCli().isRunOnce()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            executor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("sync-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            executor.execute(this::loop);
            log.info("Sync scheduler started");
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (executor != null) {
                executor.shutdownNow();
                try {
                    executor.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                executor = null;
            }
            log.info("Sync scheduler stopped");
        }
    }

    private void loop() {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            Duration wait;
            try {
                wait = runDueJobs();
            } catch (Exception e) {
                log.warn("Scheduler iteration failed", e);
                wait = Duration.ofSeconds(properties.getScheduler().getIdleSeconds());
            } catch (Error e) {
                log.error("Scheduler iteration failed with an error", e);
                wait = Duration.ofSeconds(properties.getScheduler().getIdleSeconds());
            }
            sleep(wait);
        }
    }

    /**
     * Runs every job that is due now, catalog before channels, and returns how long to wait until
     * the earliest next run. The index is rebuilt once if anything ran.
     */
    public synchronized Duration runDueJobs() {
        Instant now = clock.instant();
        boolean ranAny = false;
        for (SyncJob job : jobRunner.jobs()) {
            if (!job.isEnabled()) {
                if (nextRuns.remove(job.kind()) != null) {
                    publishNextRuns();
                }
                continue;
            }
            Instant due = nextRuns.get(job.kind());
            if (due == null) {
                due = now;
                nextRuns.put(job.kind(), due);
                publishNextRuns();
            }
            if (now.isBefore(due)) {
                continue;
            }
            JobStatusRecord record = jobRunner.execute(job, cycles.incrementAndGet());
            Instant finishedAt = record.finishedAt() == null ? clock.instant() : record.finishedAt();
            nextRuns.put(job.kind(), finishedAt.plus(job.interval()));
            publishNextRuns();
            ranAny = true;
        }
        if (ranAny) {
            jobRunner.rebuildIndex();
        }
        return untilNextRun();
    }

    /** Latest next-run instants; readable while a job is running. */
    public Map<JobKind, Instant> nextRuns() {
        return publishedNextRuns;
    }

    private void publishNextRuns() {
        Map<JobKind, Instant> copy = new EnumMap<>(JobKind.class);
        copy.putAll(nextRuns);
        publishedNextRuns = Collections.unmodifiableMap(copy);
    }

    private Duration untilNextRun() {
        if (nextRuns.isEmpty()) {
            return Duration.ofSeconds(properties.getScheduler().getIdleSeconds());
        }
        Instant earliest = nextRuns.values().stream().min(Instant::compareTo).orElseThrow();
        Duration wait = Duration.between(clock.instant(), earliest);
        return wait.isNegative() ? Duration.ZERO : wait;
    }

    private void sleep(Duration duration) {
        try {
            TimeUnit.MILLISECONDS.sleep(Math.max(0L, duration.toMillis()));
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
