package com.opencalsync.common.exception;

/**
 * Input rejected by a business rule: bad date range, duplicate platform registration, invalid feed URL.
 */
public class ValidationException extends BusinessException {
    public ValidationException(String message) {
        super(message, "VALIDATION_ERROR");
    }

    public ValidationException(String message, String errorCode) {
        super(message, errorCode);
    }
}
