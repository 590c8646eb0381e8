package com.opencalsync.sync.exception;

/**
 * Network failure, timeout, non-2xx response or redirect loop while downloading a feed.
 */
public class FeedFetchException extends FeedException {

    public FeedFetchException(String message) {
        super(message, "FEED_FETCH_FAILED");
    }

    public FeedFetchException(String message, Throwable cause) {
        super(message, cause, "FEED_FETCH_FAILED");
    }
}
