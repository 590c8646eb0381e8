package com.opencalsync.common.exception;

/**
 * Thrown when a connection, event or conflict does not exist (or is not visible to the caller).
 */
public class ResourceNotFoundException extends BusinessException {
    public ResourceNotFoundException(String message) {
        super(message, "RESOURCE_NOT_FOUND");
    }

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(String.format("%s with identifier %s not found", resourceType, identifier), "RESOURCE_NOT_FOUND");
    }
}
