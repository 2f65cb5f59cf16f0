package com.flagship.equipment_booking.asset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Physical status of an asset.
 */
public enum AssetStatus {
    AVAILABLE("available"),
    IN_USE("in-use"),
    BROKEN("broken"),
    SOLD("sold"),
    DESTROYED("destroyed"),
    DELETED("deleted");

    private final String value;

    AssetStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AssetStatus fromValue(String value) {
        return Arrays.stream(values())
            .filter(status -> status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown asset status: " + value));
    }

    /**
     * Whether an asset in this status can never be booked, whatever its
     * calendar looks like.
     */
    public boolean blocksBooking() {
        return switch (this) {
            case BROKEN, SOLD, DESTROYED, DELETED -> true;
            case AVAILABLE, IN_USE -> false;
        };
    }
}
