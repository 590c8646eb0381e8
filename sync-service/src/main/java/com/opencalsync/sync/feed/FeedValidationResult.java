package com.opencalsync.sync.feed;

public record FeedValidationResult(
        boolean valid,
        int entryCount,
        String message,
        String errorCode
) {
    public static FeedValidationResult ok(int entryCount) {
        return new FeedValidationResult(true, entryCount,
                "Feed is reachable and contains " + entryCount + " event(s)", null);
    }

    public static FeedValidationResult failed(String message, String errorCode) {
        return new FeedValidationResult(false, 0, message, errorCode);
    }
}
