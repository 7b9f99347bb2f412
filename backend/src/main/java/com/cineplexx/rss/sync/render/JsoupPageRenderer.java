package com.cineplexx.rss.sync.render;

import com.cineplexx.rss.config.SyncProperties;
import com.cineplexx.rss.sync.model.CatalogEntry;
import com.cineplexx.rss.sync.model.SessionSlot;
import com.cineplexx.rss.sync.util.CatalogUrls;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

@Component
public class JsoupPageRenderer implements PageRenderer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_TITLE_LENGTH = 2;
    private static final String TITLE_CLASSES = ".movie-title, .movie__title, .film-title, .film__title";

    private final SyncProperties properties;

    public JsoupPageRenderer(SyncProperties properties) {
        this.properties = properties;
    }

    @Override
    public RenderResult<List<CatalogEntry>> renderListing(String location, LocalDate date) {
        String url = CatalogUrls.listingUrl(properties.getBaseUrl(), location, date.toString());
        RenderResult<Document> page = load(url);
        if (!page.isSuccessful()) {
            return RenderResult.failure(page.errorCode(), page.errorMessage());
        }
        return parse(() -> extractListing(page.value()));
    }

    @Override
    public RenderResult<String> renderDescription(String canonicalUrl) {
        RenderResult<Document> page = load(canonicalUrl);
        if (!page.isSuccessful()) {
            return RenderResult.failure(page.errorCode(), page.errorMessage());
        }
        return parse(() -> extractDescription(page.value()));
    }

    @Override
    public RenderResult<List<SessionSlot>> renderSchedule(String canonicalUrl, LocalDate date, String location) {
        RenderResult<Document> page = load(CatalogUrls.scheduleUrl(canonicalUrl, location, date.toString()));
        if (!page.isSuccessful()) {
            return RenderResult.failure(page.errorCode(), page.errorMessage());
        }
        return parse(() -> extractSessions(page.value(), date));
    }

    List<CatalogEntry> extractListing(Document document) {
        Map<String, CatalogEntry> seen = new LinkedHashMap<>();
        for (Element anchor : document.select("a[href*=/film/]")) {
            String href = anchor.absUrl("href");
            if (href.isBlank()) {
                href = anchor.attr("href");
            }
            String canonical = CatalogUrls.canonicalize(href);
            if (canonical == null || !CatalogUrls.isFilmUrl(canonical)) {
                continue;
            }
            String title = titleOf(anchor);
            if (title == null) {
                continue;
            }
            seen.putIfAbsent(canonical, new CatalogEntry(title, canonical));
        }
        return new ArrayList<>(seen.values());
    }

    String extractDescription(Document document) {
        List<String> paragraphs = new ArrayList<>();
        for (Element element : document.select(".b-movie-description__text")) {
            String text = normalizeSpace(element.text());
            if (!text.isEmpty()) {
                paragraphs.add(text);
            }
        }
        if (!paragraphs.isEmpty()) {
            return String.join("\n\n", paragraphs);
        }
        Element fallback = document.selectFirst(".b-movie-description");
        return fallback == null ? "" : normalizeSpace(fallback.text());
    }

    List<SessionSlot> extractSessions(Document document, LocalDate date) {
        List<SessionSlot> sessions = new ArrayList<>();
        for (Element item : document.select("li[data-session-id]")) {
            String info = "";
            for (Element infoElement : item.select("p.l-tickets__item-info")) {
                String text = infoElement.text().trim();
                if (!text.isEmpty()) {
                    info = text;
                    break;
                }
            }
            String purchaseUrl = "";
            Element link = item.selectFirst("a[href]");
            if (link != null) {
                purchaseUrl = link.absUrl("href");
                if (purchaseUrl.isBlank()) {
                    purchaseUrl = link.attr("href");
                }
            }
            sessions.add(new SessionSlot(
                date,
                textOf(item.selectFirst("p.l-tickets__item-time")),
                textOf(item.selectFirst("p.l-tickets__item-cinema")),
                info,
                item.attr("data-session-id"),
                venueOf(document, item),
                purchaseUrl
            ));
        }
        return sessions;
    }

    private RenderResult<Document> load(String url) {
        try {
            Document document = Jsoup.connect(url)
                .userAgent(properties.getUserAgent())
                .timeout(properties.getRenderTimeoutSeconds() * 1000)
                .header("Accept-Language", "en-US,en;q=0.8")
                .get();
            return RenderResult.ok(document);
        } catch (SocketTimeoutException e) {
            return RenderResult.failure(RenderResult.TIMEOUT, e.getMessage());
        } catch (HttpStatusException e) {
            return RenderResult.failure(RenderResult.HTTP_ERROR, "status=" + e.getStatusCode());
        } catch (IOException | IllegalArgumentException e) {
            return RenderResult.failure(RenderResult.NAVIGATION_ERROR, e.getMessage());
        }
    }

    private <T> RenderResult<T> parse(Extraction<T> extraction) {
        try {
            return RenderResult.ok(extraction.extract());
        } catch (RuntimeException e) {
            return RenderResult.failure(RenderResult.PARSE_ERROR, e.getMessage());
        }
    }

    private String titleOf(Element anchor) {
        List<String> candidates = new ArrayList<>();
        candidates.add(anchor.text());
        candidates.add(anchor.attr("aria-label"));
        candidates.add(anchor.attr("title"));
        Element dataTitle = anchor.selectFirst("[data-title]");
        candidates.add(dataTitle == null ? null : dataTitle.attr("data-title"));
        Element titleElement = anchor.selectFirst(TITLE_CLASSES);
        candidates.add(titleElement == null ? null : titleElement.text());
        Element image = anchor.selectFirst("img");
        if (image != null) {
            candidates.add(image.attr("alt"));
            candidates.add(image.attr("title"));
        }
        for (String candidate : candidates) {
            String normalized = normalizeSpace(candidate);
            if (normalized.length() >= MIN_TITLE_LENGTH) {
                return normalized;
            }
        }
        return null;
    }

    private String venueOf(Document document, Element item) {
        Element wrapper = item.closest("div[id^=data-]");
        if (wrapper != null && !wrapper.id().isBlank()) {
            String name = wrapper.id().replaceFirst("^data-", "").replace('-', ' ').trim();
            if (!name.isEmpty()) {
                return name;
            }
        }
        return textOf(document.selectFirst("a.b-entity-content__title, a.b-entity-content__link"));
    }

    private static String textOf(Element element) {
        return element == null ? "" : element.text().trim();
    }

    static String normalizeSpace(String value) {
        if (value == null) {
            return "";
        }
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    @FunctionalInterface
    private interface Extraction<T> {
        T extract();
    }
}
