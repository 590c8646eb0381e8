package com.opencalsync.sync.conflict;

public record CleanupResult(int resolved, int recalculated) {

    public static CleanupResult none() {
        return new CleanupResult(0, 0);
    }

    public CleanupResult plus(CleanupResult other) {
        return new CleanupResult(resolved + other.resolved, recalculated + other.recalculated);
    }
}
