package com.opencalsync.sync.lifecycle;

import com.opencalsync.sync.domain.model.CalendarConnection;
import com.opencalsync.sync.feed.FeedValidationResult;

public record ConnectionCheck(CalendarConnection connection, FeedValidationResult validation) {
}
