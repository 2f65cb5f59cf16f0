package com.flagship.equipment_booking.booking;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum BookingTargetType {
    ASSET("asset"),
    KIT("kit"),
    GROUP_MEMBER("group-member");

    private final String value;

    BookingTargetType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static BookingTargetType fromValue(String value) {
        return Arrays.stream(values())
            .filter(type -> type.value.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown booking target type: " + value));
    }
}
