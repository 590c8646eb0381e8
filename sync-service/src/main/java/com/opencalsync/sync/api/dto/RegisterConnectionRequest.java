package com.opencalsync.sync.api.dto;

import com.opencalsync.sync.domain.model.Platform;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record RegisterConnectionRequest(
        @NotNull(message = "Platform cannot be null")
        Platform platform,

        @NotBlank(message = "Feed URL cannot be blank")
        @Size(max = 2048, message = "Feed URL is too long")
        String feedUrl,

        @Min(value = 15, message = "Sync frequency must be at least 15 minutes")
        Integer syncFrequencyMinutes
) {
}
