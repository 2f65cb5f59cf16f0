package com.flagship.equipment_booking.allocation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AllocationStatus {
    FULFILLED("fulfilled"),
    SHORTAGE("shortage");

    private final String value;

    AllocationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
