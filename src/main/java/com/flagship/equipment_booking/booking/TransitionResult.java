package com.flagship.equipment_booking.booking;

import lombok.Value;

/**
 * Outcome of applying a {@link BookingAction} to a {@link BookingStatus}:
 * either the next status or the reason the action was rejected.
 */
@Value
public class TransitionResult {
    BookingStatus from;
    BookingAction action;
    BookingStatus next;
    String rejection;

    static TransitionResult allowed(BookingStatus from, BookingAction action, BookingStatus next) {
        return new TransitionResult(from, action, next, null);
    }

    static TransitionResult rejected(BookingStatus from, BookingAction action, String reason) {
        return new TransitionResult(from, action, null, reason);
    }

    public boolean isAllowed() {
        return next != null;
    }

    /**
     * @return the next status
     * @throws IllegalStateException carrying the rejection message
     */
    public BookingStatus orElseThrow() {
        if (next == null) {
            throw new IllegalStateException(rejection);
        }
        return next;
    }
}
