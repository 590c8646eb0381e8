package com.opencalsync.sync.domain.model;

/**
 * Distribution platform that publishes a feed, or {@link #MANUAL} for events entered by hand
 * (including events converted from a removed connection).
 */
public enum Platform {
    AIRBNB("Airbnb"),
    BOOKING_COM("Booking.com"),
    VRBO("VRBO"),
    EXPEDIA("Expedia"),
    TRIPADVISOR("TripAdvisor"),
    OTHER("Other"),
    MANUAL("Manual");

    private final String displayName;

    Platform(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
