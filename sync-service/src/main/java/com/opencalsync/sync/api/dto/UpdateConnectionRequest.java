package com.opencalsync.sync.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * Partial update: null fields are left unchanged.
 */
public record UpdateConnectionRequest(
        @Size(max = 2048, message = "Feed URL is too long")
        String feedUrl,

        @Min(value = 15, message = "Sync frequency must be at least 15 minutes")
        Integer syncFrequencyMinutes
) {
}
