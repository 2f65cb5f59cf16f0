package com.flagship.equipment_booking.booking;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Booking lifecycle status.
 *
 * Valid transitions:
 * - PENDING -> APPROVED
 * - APPROVED -> ACTIVE (check-out)
 * - ACTIVE -> COMPLETED (check-in)
 * - PENDING, APPROVED, ACTIVE -> CANCELLED
 *
 * COMPLETED and CANCELLED are terminal.
 */
public enum BookingStatus {
    PENDING("pending"),
    APPROVED("approved"),
    ACTIVE("active"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    /**
     * Statuses that hold assets and make them unavailable for overlapping windows.
     */
    public static final Set<BookingStatus> BLOCKING = EnumSet.of(APPROVED, ACTIVE);

    private final String value;

    BookingStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static BookingStatus fromValue(String value) {
        return Arrays.stream(values())
            .filter(status -> status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown booking status: " + value));
    }

    public boolean isBlocking() {
        return BLOCKING.contains(this);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
