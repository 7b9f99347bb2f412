package com.cineplexx.rss.sync.service;

import com.cineplexx.rss.config.SyncProperties;
import com.cineplexx.rss.sync.channel.ChannelFetchException;
import com.cineplexx.rss.sync.channel.TelegramChannelClient;
import com.cineplexx.rss.sync.feed.ChannelFeedWriter;
import com.cineplexx.rss.sync.model.ChannelFeed;
import com.cineplexx.rss.sync.model.ChannelPost;
import com.cineplexx.rss.sync.model.JobContext;
import com.cineplexx.rss.sync.model.JobKind;
import com.cineplexx.rss.sync.model.JobOutcome;
import com.cineplexx.rss.sync.model.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChannelSyncServiceTest {
    private static final Instant NOW = Instant.parse("2026-01-05T09:00:00Z");

    @Mock
    private TelegramChannelClient channelClient;

    @TempDir
    Path outDir;

    private SyncProperties properties;
    private ChannelSyncService service;
    private JobContext context;

    @BeforeEach
    void setUp() {
        properties = new SyncProperties();
        properties.setOutDir(outDir.toString());
        properties.getChannelJob().setPostLimit(3);
        service = new ChannelSyncService(
            channelClient,
            new ChannelFeedWriter(),
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC)
        );
        context = new JobContext("run-1", JobKind.CHANNEL, 1, NOW, LoggerFactory.getLogger(getClass()));
    }

    @Test
    void allChannelsPublishedIsOk() throws Exception {
        properties.getChannelJob().setChannels(List.of("@durov", "telegram"));
        when(channelClient.fetch("durov", 3)).thenReturn(feed("durov", 2));
        when(channelClient.fetch("telegram", 3)).thenReturn(feed("telegram", 1));

        JobOutcome outcome = service.run(context);

        assertThat(outcome.status()).isEqualTo(JobStatus.OK);
        assertThat(outcome.counts()).containsEntry("ok", 2).containsEntry("failed", 0).containsEntry("posts", 3);
        assertThat(outDir.resolve("durov.xml")).exists();
        assertThat(outDir.resolve("telegram.xml")).exists();
    }

    @Test
    void oneFailingChannelDoesNotStopTheOthers() throws Exception {
        properties.getChannelJob().setChannels(List.of("broken", "crashing", "durov"));
        when(channelClient.fetch("broken", 3))
            .thenThrow(new ChannelFetchException("broken", "HTTP 404 for /s/broken", null));
        when(channelClient.fetch("crashing", 3)).thenThrow(new IllegalStateException("parser bug"));
        when(channelClient.fetch("durov", 3)).thenReturn(feed("durov", 1));

        JobOutcome outcome = service.run(context);

        assertThat(outcome.status()).isEqualTo(JobStatus.PARTIAL);
        assertThat(outcome.counts()).containsEntry("channels", 3).containsEntry("ok", 1).containsEntry("failed", 2);
        assertThat(outcome.error()).contains("broken: HTTP 404").contains("crashing: parser bug");
        assertThat(outDir.resolve("durov.xml")).exists();
        assertThat(Files.exists(outDir.resolve("broken.xml"))).isFalse();
    }

    @Test
    void everyChannelFailingIsAnError() throws Exception {
        properties.getChannelJob().setChannels(List.of("broken", "gone"));
        when(channelClient.fetch("broken", 3))
            .thenThrow(new ChannelFetchException("broken", "HTTP 404 for /s/broken", null));
        when(channelClient.fetch("gone", 3))
            .thenThrow(new ChannelFetchException("gone", "HTTP 410 for /s/gone", null));

        JobOutcome outcome = service.run(context);

        assertThat(outcome.status()).isEqualTo(JobStatus.ERROR);
        assertThat(outcome.status().isSuccessful()).isFalse();
        assertThat(outcome.counts()).containsEntry("ok", 0).containsEntry("failed", 2);
        assertThat(outcome.error()).contains("broken: HTTP 404").contains("gone: HTTP 410");
    }

    @Test
    void feedLinksFollowConfiguredChannels() {
        properties.getChannelJob().setChannels(List.of("https://t.me/durov"));

        assertThat(service.feedLinks()).singleElement()
            .satisfies(link -> {
                assertThat(link.href()).isEqualTo("durov.xml");
                assertThat(link.kind()).isEqualTo(JobKind.CHANNEL);
            });
    }

    private static ChannelFeed feed(String channel, int posts) {
        List<ChannelPost> items = new ArrayList<>();
        for (int i = posts; i >= 1; i--) {
            items.add(new ChannelPost(
                channel + "/" + i,
                "https://t.me/" + channel + "/" + i,
                "Post " + i,
                "Post " + i,
                NOW.minusSeconds(i * 60L)
            ));
        }
        return new ChannelFeed(channel, channel, "", "https://t.me/s/" + channel, items);
    }
}
