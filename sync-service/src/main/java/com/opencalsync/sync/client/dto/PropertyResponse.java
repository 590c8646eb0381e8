package com.opencalsync.sync.client.dto;

public record PropertyResponse(
        Long id,
        Long ownerId,
        String name,
        boolean active
) {
}
