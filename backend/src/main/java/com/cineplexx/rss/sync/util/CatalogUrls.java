package com.cineplexx.rss.sync.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class CatalogUrls {
    private static final String FILM_PATH_MARKER = "/film/";

    private CatalogUrls() {
    }

    /**
     * Strips the query string and fragment, leaving the stable identity of a catalog item.
     * Returns null for blank or non-http(s) input.
     */
    public static String canonicalize(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        String trimmed = candidate.trim();
        int cut = indexOfAny(trimmed, '?', '#');
        String base = cut >= 0 ? trimmed.substring(0, cut) : trimmed;
        URI uri = safeUri(base);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme();
        if (scheme == null || (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme))) {
            return null;
        }
        return base;
    }

    public static boolean isFilmUrl(String url) {
        return url != null && url.toLowerCase(Locale.ROOT).contains(FILM_PATH_MARKER);
    }

    public static String listingUrl(String baseUrl, String location, String date) {
        return baseUrl + "/cinemas?location=" + location + "&date=" + date;
    }

    public static String scheduleUrl(String canonicalUrl, String location, String date) {
        return canonicalUrl + "?date=" + date + "&location=" + location;
    }

    public static URI safeUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static int indexOfAny(String value, char first, char second) {
        int a = value.indexOf(first);
        int b = value.indexOf(second);
        if (a < 0) {
            return b;
        }
        if (b < 0) {
            return a;
        }
        return Math.min(a, b);
    }
}
