package com.opencalsync.sync.exception;

public class EmptyFeedException extends FeedException {

    public EmptyFeedException(String url) {
        super("Calendar feed contains no events: " + url, "FEED_EMPTY");
    }

    public EmptyFeedException(String url, int discarded) {
        super("Calendar feed contains no usable events (" + discarded + " discarded): " + url, "FEED_EMPTY");
    }
}
