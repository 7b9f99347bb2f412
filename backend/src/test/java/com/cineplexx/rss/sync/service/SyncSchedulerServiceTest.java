package com.cineplexx.rss.sync.service;

import com.cineplexx.rss.config.SyncProperties;
import com.cineplexx.rss.sync.feed.FeedIndexBuilder;
import com.cineplexx.rss.sync.model.FeedLink;
import com.cineplexx.rss.sync.model.JobContext;
import com.cineplexx.rss.sync.model.JobKind;
import com.cineplexx.rss.sync.model.JobOutcome;
import com.cineplexx.rss.sync.model.JobStatus;
import com.cineplexx.rss.sync.model.JobStatusRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SyncSchedulerServiceTest {
    private static final Instant T0 = Instant.parse("2026-01-05T09:00:00Z");

    @Mock
    private JobStatusService statusService;

    @Mock
    private FeedIndexBuilder indexBuilder;

    private MutableClock clock;
    private FakeSyncJob catalogJob;
    private FakeSyncJob channelJob;
    private SyncProperties properties;
    private SyncSchedulerService scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        catalogJob = new FakeSyncJob(JobKind.CATALOG, Duration.ofHours(1), Duration.ofMinutes(10), clock);
        channelJob = new FakeSyncJob(JobKind.CHANNEL, Duration.ofMinutes(30), Duration.ofMinutes(1), clock);
        properties = new SyncProperties();
        properties.getScheduler().setEnabled(false);
        SyncJobRunner runner = new SyncJobRunner(List.of(catalogJob, channelJob), statusService, indexBuilder, clock);
        scheduler = new SyncSchedulerService(runner, properties, clock);
    }

    @Test
    void bothJobsRunOnFirstWakeUpAndAreRescheduledFromTheirOwnFinish() throws Exception {
        Duration wait = scheduler.runDueJobs();

        assertThat(catalogJob.runs()).hasSize(1);
        assertThat(channelJob.runs()).hasSize(1);
        assertThat(catalogJob.runs().get(0).cycle()).isEqualTo(1);
        assertThat(channelJob.runs().get(0).cycle()).isEqualTo(2);
        assertThat(scheduler.nextRuns())
            .containsEntry(JobKind.CATALOG, T0.plus(Duration.ofMinutes(70)))
            .containsEntry(JobKind.CHANNEL, T0.plus(Duration.ofMinutes(41)));
        assertThat(wait).isEqualTo(Duration.ofMinutes(30));
        verify(indexBuilder, times(1)).rebuild(any(), any());
    }

    @Test
    void channelCadenceIsIndependentOfCatalogCadence() throws Exception {
        scheduler.runDueJobs();

        clock.set(T0.plus(Duration.ofMinutes(41)));
        Duration wait = scheduler.runDueJobs();

        assertThat(catalogJob.runs()).hasSize(1);
        assertThat(channelJob.runs()).hasSize(2);
        assertThat(scheduler.nextRuns())
            .containsEntry(JobKind.CATALOG, T0.plus(Duration.ofMinutes(70)))
            .containsEntry(JobKind.CHANNEL, T0.plus(Duration.ofMinutes(72)));
        assertThat(wait).isEqualTo(Duration.ofMinutes(28));
        verify(indexBuilder, times(2)).rebuild(any(), any());
    }

    @Test
    void wakeUpWithNothingDueDoesNotRebuildIndex() throws Exception {
        scheduler.runDueJobs();

        clock.set(T0.plus(Duration.ofMinutes(20)));
        Duration wait = scheduler.runDueJobs();

        assertThat(catalogJob.runs()).hasSize(1);
        assertThat(channelJob.runs()).hasSize(1);
        assertThat(wait).isEqualTo(Duration.ofMinutes(21));
        verify(indexBuilder, times(1)).rebuild(any(), any());
    }

    @Test
    void failingCatalogJobDoesNotBlockChannelJob() {
        catalogJob.failWith(new IllegalStateException("boom"));

        scheduler.runDueJobs();

        assertThat(channelJob.runs()).hasSize(1);
        assertThat(scheduler.nextRuns()).containsEntry(JobKind.CATALOG, T0.plus(Duration.ofMinutes(70)));
        verify(statusService).record(
            eq(JobKind.CATALOG),
            argThat((JobStatusRecord record) -> record.status() == JobStatus.ERROR)
        );
        verify(statusService).record(
            eq(JobKind.CHANNEL),
            argThat((JobStatusRecord record) -> record.status() == JobStatus.OK)
        );
    }

    @Test
    void disabledJobIsNeitherRunNorScheduled() throws Exception {
        catalogJob.setEnabled(false);

        scheduler.runDueJobs();

        assertThat(catalogJob.runs()).isEmpty();
        assertThat(scheduler.nextRuns()).containsOnlyKeys(JobKind.CHANNEL);
    }

    @Test
    void idlesWhenNoJobIsEnabled() throws Exception {
        catalogJob.setEnabled(false);
        channelJob.setEnabled(false);

        Duration wait = scheduler.runDueJobs();

        assertThat(wait).isEqualTo(Duration.ofSeconds(60));
        assertThat(scheduler.nextRuns()).isEmpty();
        verify(indexBuilder, never()).rebuild(any(), any());
    }

    @Test
    void startAndStopToggleRunningState() {
        catalogJob.setEnabled(false);
        channelJob.setEnabled(false);

        scheduler.start();
        assertThat(scheduler.isRunning()).isTrue();

        scheduler.stop();
        assertThat(scheduler.isRunning()).isFalse();
    }

    @Test
    void disabledSchedulerDoesNotStartOnBoot() {
        scheduler.startIfEnabled();

        assertThat(scheduler.isRunning()).isFalse();
    }

    @Test
    void nextRunsStayReadableWhileAJobIsRunning() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        SyncJobRunner runner = new SyncJobRunner(
            List.of(new BlockingSyncJob(started, release)),
            statusService,
            indexBuilder,
            clock
        );
        SyncSchedulerService blockingScheduler = new SyncSchedulerService(runner, properties, clock);
        ExecutorService worker = Executors.newSingleThreadExecutor();
        try {
            Future<Duration> pass = worker.submit(blockingScheduler::runDueJobs);
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            Map<JobKind, Instant> during = CompletableFuture.supplyAsync(blockingScheduler::nextRuns)
                .get(1, TimeUnit.SECONDS);
            assertThat(during).containsEntry(JobKind.CATALOG, T0);

            release.countDown();
            pass.get(5, TimeUnit.SECONDS);
            assertThat(blockingScheduler.nextRuns()).containsEntry(JobKind.CATALOG, T0.plus(Duration.ofHours(1)));
        } finally {
            release.countDown();
            worker.shutdownNow();
        }
    }

    @Test
    void loopSurvivesErrorsThrownByAJob() throws Exception {
        channelJob.setEnabled(false);
        catalogJob.failWith(new StackOverflowError("deep recursion"));
        properties.getScheduler().setIdleSeconds(1);

        scheduler.start();
        try {
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
            while (catalogJob.runs().size() < 2 && System.nanoTime() < deadline) {
                Thread.sleep(50);
            }
            assertThat(catalogJob.runs()).hasSizeGreaterThanOrEqualTo(2);
            assertThat(scheduler.isRunning()).isTrue();
        } finally {
            scheduler.stop();
        }
    }

    private static final class BlockingSyncJob implements SyncJob {
        private final CountDownLatch started;
        private final CountDownLatch release;

        BlockingSyncJob(CountDownLatch started, CountDownLatch release) {
            this.started = started;
            this.release = release;
        }

        @Override
        public JobKind kind() {
            return JobKind.CATALOG;
        }

        @Override
        public boolean isEnabled() {
            return true;
        }

        @Override
        public Duration interval() {
            return Duration.ofHours(1);
        }

        @Override
        public List<FeedLink> feedLinks() {
            return List.of();
        }

        @Override
        public JobOutcome run(JobContext context) throws InterruptedException {
            started.countDown();
            if (!release.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("job was never released");
            }
            return JobOutcome.ok(Map.of());
        }
    }
}
