package com.cineplexx.rss.sync.render;

/**
 * Outcome of one Page Renderer call: either a value or an error code. Failures are data, not
 * exceptions, so that callers decide locally how to degrade.
 */
public record RenderResult<T>(T value, String errorCode, String errorMessage) {
    public static final String TIMEOUT = "timeout";
    public static final String NAVIGATION_ERROR = "navigation_error";
    public static final String HTTP_ERROR = "http_error";
    public static final String PARSE_ERROR = "parse_error";

    public static <T> RenderResult<T> ok(T value) {
        return new RenderResult<>(value, null, null);
    }

    public static <T> RenderResult<T> failure(String errorCode, String errorMessage) {
        return new RenderResult<>(null, errorCode, errorMessage);
    }

    public boolean isSuccessful() {
        return errorCode == null;
    }

    public T valueOr(T fallback) {
        return isSuccessful() && value != null ? value : fallback;
    }
}
