package com.opencalsync.sync.lifecycle;

import com.opencalsync.sync.conflict.CleanupResult;
import com.opencalsync.sync.domain.model.CalendarConnection;

public record RemovalResult(CalendarConnection connection, DispositionResult disposition, CleanupResult cleanup) {
}
