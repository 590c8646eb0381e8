package com.opencalsync.sync.api.dto;

import com.opencalsync.sync.lifecycle.RegistrationResult;
import com.opencalsync.sync.reconcile.ConnectionSyncResult;

public record ConnectionRegistrationResponse(
        ConnectionResponse connection,
        ConnectionSyncResult initialSync
) {
    public static ConnectionRegistrationResponse from(RegistrationResult result) {
        return new ConnectionRegistrationResponse(ConnectionResponse.from(result.connection()), result.initialSync());
    }
}
