package com.cineplexx.rss.sync.api;

import com.cineplexx.rss.sync.model.FeedLink;
import com.cineplexx.rss.sync.model.RunStatus;
import com.cineplexx.rss.sync.model.SchedulerStatusResponse;
import com.cineplexx.rss.sync.service.JobStatusService;
import com.cineplexx.rss.sync.service.SyncJobRunner;
import com.cineplexx.rss.sync.service.SyncSchedulerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class SyncStatusController {
    private final JobStatusService statusService;
    private final SyncJobRunner jobRunner;
    private final SyncSchedulerService schedulerService;

    public SyncStatusController(
        JobStatusService statusService,
        SyncJobRunner jobRunner,
        SyncSchedulerService schedulerService
    ) {
        this.statusService = statusService;
        this.jobRunner = jobRunner;
        this.schedulerService = schedulerService;
    }

    @GetMapping("/status")
    public RunStatus status() {
        return statusService.current();
    }

    @GetMapping("/feeds")
    public List<FeedLink> feeds() {
        return jobRunner.feedLinks();
    }

    @GetMapping("/scheduler")
    public SchedulerStatusResponse scheduler() {
        return new SchedulerStatusResponse(schedulerService.isRunning(), schedulerService.nextRuns());
    }
}
