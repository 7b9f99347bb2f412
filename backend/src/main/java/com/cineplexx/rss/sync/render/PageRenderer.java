package com.cineplexx.rss.sync.render;

import com.cineplexx.rss.sync.model.CatalogEntry;
import com.cineplexx.rss.sync.model.SessionSlot;

import java.time.LocalDate;
import java.util.List;

/**
 * Loads catalog pages and extracts their content. Every call is bounded by a timeout; a timeout
 * or navigation failure comes back as a failed {@link RenderResult}, never as an exception.
 */
public interface PageRenderer {

    RenderResult<List<CatalogEntry>> renderListing(String location, LocalDate date);

    /** Whitespace-normalised description, possibly empty. */
    RenderResult<String> renderDescription(String canonicalUrl);

    /** Sessions shown for the title on the given date, each stamped with that date. */
    RenderResult<List<SessionSlot>> renderSchedule(String canonicalUrl, LocalDate date, String location);
}
