package com.opencalsync.common.util;

/**
 * Constants shared by the calendar sync modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String SYNC_LOCK_PREFIX = "lock:sync:connection:";
    public static final String CONFLICT_LOCK_PREFIX = "lock:conflicts:property:";

    public static final String USER_ID_HEADER = "X-User-Id";

    public static final int MIN_SYNC_FREQUENCY_MINUTES = 15;
    public static final int DEFAULT_SYNC_FREQUENCY_MINUTES = 60;
}
