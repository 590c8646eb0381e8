package com.opencalsync.sync.exception;

/**
 * The downloaded document is not a well-formed iCalendar feed.
 */
public class FeedParseException extends FeedException {

    public FeedParseException(String message) {
        super(message, "FEED_PARSE_FAILED");
    }

    public FeedParseException(String message, Throwable cause) {
        super(message, cause, "FEED_PARSE_FAILED");
    }
}
