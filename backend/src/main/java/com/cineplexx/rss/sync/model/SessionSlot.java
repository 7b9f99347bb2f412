package com.cineplexx.rss.sync.model;

import java.time.LocalDate;

public record SessionSlot(
    LocalDate date,
    String time,
    String hall,
    String info,
    String sessionId,
    String venueName,
    String purchaseUrl
) {
    public SessionSlot withDate(LocalDate windowDate) {
        return new SessionSlot(windowDate, time, hall, info, sessionId, venueName, purchaseUrl);
    }
}
