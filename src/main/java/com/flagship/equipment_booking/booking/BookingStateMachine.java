package com.flagship.equipment_booking.booking;

/**
 * Pure transition function of the booking lifecycle.
 *
 * pending -> approved -> active -> completed, and cancelled from any
 * non-terminal status. Nothing here touches storage.
 */
public final class BookingStateMachine {

    private BookingStateMachine() {
    }

    public static TransitionResult transition(BookingStatus from, BookingAction action) {
        return switch (action) {
            case APPROVE -> require(from, action, BookingStatus.PENDING, BookingStatus.APPROVED);
            case CHECK_OUT -> require(from, action, BookingStatus.APPROVED, BookingStatus.ACTIVE);
            case CHECK_IN -> require(from, action, BookingStatus.ACTIVE, BookingStatus.COMPLETED);
            case CANCEL -> cancel(from);
        };
    }

    public static boolean canTransition(BookingStatus from, BookingAction action) {
        return transition(from, action).isAllowed();
    }

    private static TransitionResult require(BookingStatus from, BookingAction action,
                                            BookingStatus required, BookingStatus next) {
        if (from == required) {
            return TransitionResult.allowed(from, action, next);
        }
        return TransitionResult.rejected(from, action, String.format(
            "Cannot %s booking in %s status. Only %s bookings can be %s.",
            action.verb(), from.value(), required.value(), pastTense(action)));
    }

    private static TransitionResult cancel(BookingStatus from) {
        return switch (from) {
            case PENDING, APPROVED, ACTIVE ->
                TransitionResult.allowed(from, BookingAction.CANCEL, BookingStatus.CANCELLED);
            case CANCELLED ->
                TransitionResult.rejected(from, BookingAction.CANCEL, "Booking is already cancelled");
            case COMPLETED ->
                TransitionResult.rejected(from, BookingAction.CANCEL, "Completed bookings cannot be cancelled");
        };
    }

    private static String pastTense(BookingAction action) {
        return switch (action) {
            case APPROVE -> "approved";
            case CHECK_OUT -> "checked out";
            case CHECK_IN -> "checked in";
            case CANCEL -> "cancelled";
        };
    }
}
