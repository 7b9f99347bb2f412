package com.cineplexx.rss.sync.feed;

import com.cineplexx.rss.sync.model.ChannelFeed;
import com.cineplexx.rss.sync.model.ChannelPost;
import com.cineplexx.rss.sync.util.AtomicFiles;
import com.rometools.rome.feed.rss.Item;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** One RSS document per public channel, newest post first. */
@Component
public class ChannelFeedWriter {
    private static final int TITLE_LENGTH = 100;

    public static Path feedPath(Path outDir, String channel) {
        return outDir.resolve(channel + ".xml");
    }

    public void write(Path path, ChannelFeed feed, Instant now) throws IOException {
        AtomicFiles.writeString(path, build(feed, now));
    }

    public String build(ChannelFeed feed, Instant now) {
        List<Item> items = new ArrayList<>();
        for (ChannelPost post : feed.posts()) {
            items.add(RssDocuments.item(
                postTitle(post),
                post.permalink(),
                RssDocuments.guid(post.permalink(), true),
                post.publishedAt(),
                RssDocuments.nullToEmpty(post.text()),
                post.html()
            ));
        }
        String description = feed.description() == null || feed.description().isBlank()
            ? "Posts from @" + feed.channel()
            : feed.description();
        String title = feed.title() == null || feed.title().isBlank() ? "@" + feed.channel() : feed.title();
        return RssDocuments.render(RssDocuments.channel(title, feed.link(), description, now, items));
    }

    /** First non-blank line of the post text, shortened; posts without text fall back to their id. */
    static String postTitle(ChannelPost post) {
        String text = post.text() == null ? "" : post.text().strip();
        if (text.isEmpty()) {
            return "Post " + post.postId();
        }
        String firstLine = text.lines().map(String::strip).filter(line -> !line.isEmpty()).findFirst().orElse(text);
        if (firstLine.length() <= TITLE_LENGTH) {
            return firstLine;
        }
        return firstLine.substring(0, TITLE_LENGTH - 1).strip() + "…";
    }
}
