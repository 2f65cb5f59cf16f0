package com.flagship.equipment_booking.booking;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum BookingMode {
    DATE_RANGE("date-range"),
    SINGLE_DAY("single-day");

    private final String value;

    BookingMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static BookingMode fromValue(String value) {
        return Arrays.stream(values())
            .filter(mode -> mode.value.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown booking mode: " + value));
    }
}
