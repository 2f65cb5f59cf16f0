package com.flagship.equipment_booking.asset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Where the effective value of a grouped asset's field comes from.
 */
public enum FieldSource {
    GROUP("group"),
    LOCAL("local"),
    OVERRIDE("override");

    private final String value;

    FieldSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static FieldSource fromValue(String value) {
        return Arrays.stream(values())
            .filter(source -> source.value.equalsIgnoreCase(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown field source: " + value));
    }
}
