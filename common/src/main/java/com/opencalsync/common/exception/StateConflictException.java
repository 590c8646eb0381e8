package com.opencalsync.common.exception;

/**
 * The requested transition is not allowed from the entity's current state,
 * e.g. resolving a conflict that is already resolved. Mapped to HTTP 409.
 */
public class StateConflictException extends BusinessException {
    public StateConflictException(String message) {
        super(message, "STATE_CONFLICT");
    }

    public StateConflictException(String message, String errorCode) {
        super(message, errorCode);
    }
}
