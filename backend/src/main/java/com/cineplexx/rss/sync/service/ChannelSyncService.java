package com.cineplexx.rss.sync.service;

import com.cineplexx.rss.config.SyncProperties;
import com.cineplexx.rss.sync.channel.ChannelFetchException;
import com.cineplexx.rss.sync.channel.TelegramChannelClient;
import com.cineplexx.rss.sync.feed.ChannelFeedWriter;
import com.cineplexx.rss.sync.model.ChannelFeed;
import com.cineplexx.rss.sync.model.FeedLink;
import com.cineplexx.rss.sync.model.JobContext;
import com.cineplexx.rss.sync.model.JobKind;
import com.cineplexx.rss.sync.model.JobOutcome;
import com.cineplexx.rss.sync.model.JobStatus;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Republishes each configured channel as its own feed. One channel failing never stops the rest. */
@Service
public class ChannelSyncService implements SyncJob {
    private static final int MAX_ERROR_LENGTH = 500;

    private final TelegramChannelClient channelClient;
    private final ChannelFeedWriter feedWriter;
    private final SyncProperties properties;
    private final Clock clock;

    public ChannelSyncService(
        TelegramChannelClient channelClient,
        ChannelFeedWriter feedWriter,
        SyncProperties properties,
        Clock clock
    ) {
        this.channelClient = channelClient;
        this.feedWriter = feedWriter;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public JobKind kind() {
        return JobKind.CHANNEL;
    }

    @Override
    public boolean isEnabled() {
        return properties.getChannelJob().isEnabled();
    }

    @Override
    public Duration interval() {
        return Duration.ofSeconds(properties.getChannelJob().getIntervalSeconds());
    }

    @Override
    public List<FeedLink> feedLinks() {
        List<FeedLink> links = new ArrayList<>();
        for (String channel : properties.getChannelJob().getChannels()) {
            links.add(new FeedLink(
                JobKind.CHANNEL,
                "Telegram: t.me/" + channel,
                channel + ".xml",
                "@" + channel
            ));
        }
        return links;
    }

    @Override
    public JobOutcome run(JobContext context) throws IOException {
        List<String> channels = properties.getChannelJob().getChannels();
        int postLimit = properties.getChannelJob().getPostLimit();
        Path outDir = Path.of(properties.getOutDir());
        Files.createDirectories(outDir);

        int ok = 0;
        int posts = 0;
        List<String> failures = new ArrayList<>();
        for (String channel : channels) {
            try {
                ChannelFeed feed = channelClient.fetch(channel, postLimit);
                Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
                feedWriter.write(ChannelFeedWriter.feedPath(outDir, channel), feed, now);
                ok++;
                posts += feed.posts().size();
                context.log().info("Run {} channel {} published {} posts", context.runId(), channel, feed.posts().size());
            } catch (ChannelFetchException | IOException | RuntimeException e) {
                failures.add(channel + ": " + e.getMessage());
                context.log().warn("Run {} channel {} failed", context.runId(), channel, e);
            }
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("channels", channels.size());
        counts.put("ok", ok);
        counts.put("failed", failures.size());
        counts.put("posts", posts);
        if (failures.isEmpty()) {
            return JobOutcome.ok(counts);
        }
        JobStatus status = ok == 0 ? JobStatus.ERROR : JobStatus.PARTIAL;
        return new JobOutcome(status, counts, summarize(failures));
    }

    private static String summarize(List<String> failures) {
        String summary = String.join("; ", failures);
        return summary.length() > MAX_ERROR_LENGTH ? summary.substring(0, MAX_ERROR_LENGTH) : summary;
    }
}
