package com.cineplexx.rss.sync.service;

import com.cineplexx.rss.config.SyncProperties;
import com.cineplexx.rss.sync.model.JobStatusRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/** {@code sync.cli.run-once=true}: run each enabled job once, rebuild the index, then exit. */
@Component
public class SyncCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SyncCliRunner.class);

    private final SyncProperties properties;
    private final SyncJobRunner jobRunner;
    private final ConfigurableApplicationContext applicationContext;

    public SyncCliRunner(
        SyncProperties properties,
        SyncJobRunner jobRunner,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.jobRunner = jobRunner;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRunOnce()) {
            return;
        }

        boolean anyFailed = false;
        long cycle = 0;
        for (SyncJob job : jobRunner.jobs()) {
            if (!job.isEnabled()) {
                log.info("Skipping disabled {} job", job.kind().label());
                continue;
            }
            JobStatusRecord record = jobRunner.execute(job, ++cycle);
            log.info(
                "Summary {}: status={}, durationSeconds={}, counts={}, error={}",
                job.kind().label(),
                record.status().wireName(),
                record.durationSeconds(),
                record.counts(),
                record.error()
            );
            anyFailed |= !record.isSuccessful();
        }
        jobRunner.rebuildIndex();

        if (properties.getCli().isExitAfterRun()) {
            int code = anyFailed ? 1 : 0;
            int exitCode = SpringApplication.exit(applicationContext, () -> code);
            System.exit(exitCode);
        }
    }
}
