package com.opencalsync.sync.lifecycle;

import com.opencalsync.sync.domain.model.CalendarConnection;
import com.opencalsync.sync.reconcile.ConnectionSyncResult;

/**
 * @param initialSync null when the initial sync is disabled
 */
public record RegistrationResult(CalendarConnection connection, ConnectionSyncResult initialSync) {
}
