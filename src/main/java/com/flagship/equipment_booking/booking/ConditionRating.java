package com.flagship.equipment_booking.booking;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ConditionRating {
    EXCELLENT("excellent"),
    GOOD("good"),
    FAIR("fair"),
    POOR("poor"),
    DAMAGED("damaged");

    private final String value;

    ConditionRating(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ConditionRating fromValue(String value) {
        return Arrays.stream(values())
            .filter(rating -> rating.value.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown condition rating: " + value));
    }

    /**
     * Ratings that send the returned equipment to repair.
     */
    public boolean indicatesDamage() {
        return this == POOR || this == DAMAGED;
    }
}
