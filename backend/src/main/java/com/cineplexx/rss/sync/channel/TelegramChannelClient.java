package com.cineplexx.rss.sync.channel;

import com.cineplexx.rss.config.SyncProperties;
import com.cineplexx.rss.sync.model.ChannelFeed;
import com.cineplexx.rss.sync.model.ChannelPost;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reads the public web preview of a channel ({@code /s/<channel>}) and turns its message widgets
 * into posts.
 */
@Component
public class TelegramChannelClient {
    static final Comparator<ChannelPost> NEWEST_FIRST = Comparator
        .comparing(ChannelPost::publishedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
        .thenComparingLong(TelegramChannelClient::sequenceOf)
        .reversed();

    private final SyncProperties properties;

    public TelegramChannelClient(SyncProperties properties) {
        this.properties = properties;
    }

    public ChannelFeed fetch(String channel, int postLimit) throws ChannelFetchException {
        String url = previewUrl(channel);
        Document document;
        try {
            document = Jsoup.connect(url)
                .userAgent(properties.getUserAgent())
                .timeout(properties.getRenderTimeoutSeconds() * 1000)
                .get();
        } catch (HttpStatusException e) {
            throw new ChannelFetchException(channel, "HTTP " + e.getStatusCode() + " for " + url, e);
        } catch (IOException | IllegalArgumentException e) {
            throw new ChannelFetchException(channel, "Failed to load " + url + ": " + e.getMessage(), e);
        }
        return parse(channel, document, postLimit);
    }

    String previewUrl(String channel) {
        return properties.getChannelJob().getBaseUrl() + "/s/" + channel;
    }

    ChannelFeed parse(String channel, Document document, int postLimit) {
        List<ChannelPost> posts = new ArrayList<>();
        for (Element message : document.select(".tgme_widget_message[data-post]")) {
            String postId = message.attr("data-post").trim();
            if (postId.isEmpty()) {
                continue;
            }
            Element textElement = message.selectFirst(".tgme_widget_message_text");
            posts.add(new ChannelPost(
                postId,
                properties.getChannelJob().getBaseUrl() + "/" + postId,
                textElement == null ? "" : plainText(textElement),
                textElement == null ? "" : textElement.html(),
                publishedAt(message.selectFirst("time[datetime]"))
            ));
        }
        posts.sort(NEWEST_FIRST);
        if (posts.size() > postLimit) {
            posts = new ArrayList<>(posts.subList(0, postLimit));
        }

        String title = firstText(document, ".tgme_channel_info_header_title", "meta[property=og:title]");
        String description = firstText(document, ".tgme_channel_info_description", "meta[property=og:description]");
        return new ChannelFeed(
            channel,
            title.isEmpty() ? "@" + channel : title,
            description,
            properties.getChannelJob().getBaseUrl() + "/s/" + channel,
            posts
        );
    }

    private static String plainText(Element textElement) {
        Element copy = textElement.clone();
        for (Element lineBreak : copy.select("br")) {
            lineBreak.replaceWith(new TextNode("\n"));
        }
        return copy.wholeText().strip();
    }

    private static Instant publishedAt(Element time) {
        if (time == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(time.attr("datetime")).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String firstText(Document document, String elementSelector, String metaSelector) {
        Element element = document.selectFirst(elementSelector);
        if (element != null && !element.text().isBlank()) {
            return element.text().trim();
        }
        Element meta = document.selectFirst(metaSelector);
        return meta == null ? "" : meta.attr("content").trim();
    }

    private static long sequenceOf(ChannelPost post) {
        String id = post.postId();
        int slash = id.lastIndexOf('/');
        try {
            return Long.parseLong(id.substring(slash + 1));
        } catch (NumberFormatException e) {
            return -1L;
        }
    }
}
