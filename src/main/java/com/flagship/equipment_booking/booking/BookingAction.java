package com.flagship.equipment_booking.booking;

/**
 * Lifecycle actions a caller can attempt on a booking.
 */
public enum BookingAction {
    APPROVE("approve"),
    CHECK_OUT("check out"),
    CHECK_IN("check in"),
    CANCEL("cancel");

    private final String verb;

    BookingAction(String verb) {
        this.verb = verb;
    }

    public String verb() {
        return verb;
    }
}
