package com.opencalsync.common.exception;

/**
 * Thrown when a required dependency (lock store, property directory) is temporarily unavailable.
 * Mapped to HTTP 503; the caller may retry later.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
