package com.opencalsync.sync.feed;

import java.time.LocalDate;

/**
 * One VEVENT as read from a feed, before normalization. Text fields may be null.
 */
public record RawFeedEntry(
        String uid,
        String summary,
        String description,
        String status,
        LocalDate startDate,
        LocalDate endDate
) {
}
