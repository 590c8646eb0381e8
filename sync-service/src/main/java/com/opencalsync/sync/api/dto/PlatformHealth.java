package com.opencalsync.sync.api.dto;

public record PlatformHealth(int total, int active, int error) {
}
