package com.cineplexx.rss.sync.feed;

import com.cineplexx.rss.sync.model.ChannelFeed;
import com.cineplexx.rss.sync.model.ChannelPost;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChannelFeedWriterTest {
    private final ChannelFeedWriter writer = new ChannelFeedWriter();

    @Test
    void postsBecomeItemsKeyedByPermalink() {
        ChannelFeed feed = new ChannelFeed(
            "durov",
            "Durov's Channel",
            "",
            "https://t.me/s/durov",
            List.of(
                new ChannelPost("durov/2", "https://t.me/durov/2", "Second post\nmore", "Second post<br>more",
                    Instant.parse("2026-01-05T10:00:00Z")),
                new ChannelPost("durov/1", "https://t.me/durov/1", "", "", null)
            )
        );

        Document document = Jsoup.parse(writer.build(feed, Instant.parse("2026-01-05T11:00:00Z")), "", Parser.xmlParser());

        assertThat(document.selectFirst("channel > title").text()).isEqualTo("Durov's Channel");
        assertThat(document.selectFirst("channel > description").text()).isEqualTo("Posts from @durov");
        List<Element> items = document.select("channel > item");
        assertThat(items).extracting(item -> item.selectFirst("guid").text())
            .containsExactly("https://t.me/durov/2", "https://t.me/durov/1");
        assertThat(items).extracting(item -> item.selectFirst("title").text())
            .containsExactly("Second post", "Post durov/1");
    }

    @Test
    void longFirstLinesAreShortened() {
        String text = "x".repeat(150);
        String title = ChannelFeedWriter.postTitle(new ChannelPost("c/1", "https://t.me/c/1", text, text, null));
        assertThat(title).hasSize(100).endsWith("…");
    }
}
