package com.opencalsync.sync.client;

/**
 * Read-only ownership lookups used by the connection lifecycle and manual event operations.
 */
public interface PropertyDirectory {

    /**
     * @throws com.opencalsync.common.exception.ResourceNotFoundException if the property does not exist
     *         or is not owned by {@code userId}
     * @throws com.opencalsync.common.exception.ServiceUnavailableException if the directory cannot be reached
     */
    void requireOwner(Long propertyId, Long userId);
}
