package com.cineplexx.rss.sync.feed;

import com.rometools.rome.feed.rss.Channel;
import com.rometools.rome.feed.rss.Content;
import com.rometools.rome.feed.rss.Description;
import com.rometools.rome.feed.rss.Guid;
import com.rometools.rome.feed.rss.Item;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.WireFeedOutput;

import java.time.Instant;
import java.util.Date;
import java.util.List;

/** Small helpers over ROME's RSS 2.0 wire model shared by every feed this service writes. */
final class RssDocuments {
    static final String RSS_2_0 = "rss_2.0";

    private RssDocuments() {
    }

    static Channel channel(String title, String link, String description, Instant lastBuildDate, List<Item> items) {
        Channel channel = new Channel(RSS_2_0);
        channel.setEncoding("UTF-8");
        channel.setTitle(nullToEmpty(title));
        channel.setLink(nullToEmpty(link));
        channel.setDescription(nullToEmpty(description));
        if (lastBuildDate != null) {
            channel.setLastBuildDate(Date.from(lastBuildDate));
        }
        channel.setItems(items);
        return channel;
    }

    static Item item(String title, String link, Guid guid, Instant pubDate, String description, String html) {
        Item item = new Item();
        item.setTitle(nullToEmpty(title));
        item.setLink(link);
        item.setGuid(guid);
        if (pubDate != null) {
            item.setPubDate(Date.from(pubDate));
        }
        if (description != null) {
            Description text = new Description();
            text.setType("text/plain");
            text.setValue(description);
            item.setDescription(text);
        }
        if (html != null && !html.isBlank()) {
            Content content = new Content();
            content.setType(Content.HTML);
            content.setValue(html);
            item.setContent(content);
        }
        return item;
    }

    static Guid guid(String value, boolean permaLink) {
        Guid guid = new Guid();
        guid.setValue(value);
        guid.setPermaLink(permaLink);
        return guid;
    }

    static String render(Channel channel) {
        try {
            return new WireFeedOutput().outputString(channel, true);
        } catch (FeedException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to render feed " + channel.getTitle(), e);
        }
    }

    static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
