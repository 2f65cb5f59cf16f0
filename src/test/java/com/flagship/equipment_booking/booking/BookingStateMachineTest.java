package com.flagship.equipment_booking.booking;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class BookingStateMachineTest {

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    @Test
    @DisplayName("Happy path: pending -> approved -> active -> completed")
    void testHappyPath() {
        printTestHeader("Happy Path");

        BookingStatus status = BookingStatus.PENDING;
        status = BookingStateMachine.transition(status, BookingAction.APPROVE).orElseThrow();
        assertEquals(BookingStatus.APPROVED, status);
        status = BookingStateMachine.transition(status, BookingAction.CHECK_OUT).orElseThrow();
        assertEquals(BookingStatus.ACTIVE, status);
        status = BookingStateMachine.transition(status, BookingAction.CHECK_IN).orElseThrow();
        assertEquals(BookingStatus.COMPLETED, status);
    }

    @ParameterizedTest
    @EnumSource(value = BookingStatus.class, names = {"PENDING", "APPROVED", "ACTIVE"})
    @DisplayName("Every non-terminal status can be cancelled")
    void testCancelFromNonTerminal(BookingStatus from) {
        assertEquals(BookingStatus.CANCELLED,
            BookingStateMachine.transition(from, BookingAction.CANCEL).orElseThrow());
    }

    @Test
    @DisplayName("Cancelling twice is rejected")
    void testCancelTwice() {
        printTestHeader("Cancel Twice");

        TransitionResult result = BookingStateMachine.transition(BookingStatus.CANCELLED, BookingAction.CANCEL);
        assertFalse(result.isAllowed());
        assertEquals("Booking is already cancelled", result.getRejection());
    }

    @Test
    @DisplayName("Completed bookings cannot be cancelled")
    void testCancelCompleted() {
        printTestHeader("Cancel Completed");

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> BookingStateMachine.transition(BookingStatus.COMPLETED, BookingAction.CANCEL).orElseThrow());
        assertEquals("Completed bookings cannot be cancelled", e.getMessage());
    }

    @Test
    @DisplayName("Rejection names the current status and the attempted action")
    void testRejectionMessage() {
        printTestHeader("Rejection Message");

        TransitionResult result = BookingStateMachine.transition(BookingStatus.PENDING, BookingAction.CHECK_OUT);
        assertEquals("Cannot check out booking in pending status. Only approved bookings can be checked out.",
            result.getRejection());
    }

    @ParameterizedTest
    @EnumSource(BookingAction.class)
    @DisplayName("Completed and cancelled are terminal")
    void testTerminalStatuses(BookingAction action) {
        assertFalse(BookingStateMachine.canTransition(BookingStatus.COMPLETED, action));
        assertFalse(BookingStateMachine.canTransition(BookingStatus.CANCELLED, action));
    }

    @Test
    @DisplayName("Check-in only from active")
    void testCheckInOnlyFromActive() {
        printTestHeader("Check-in Only From Active");

        assertTrue(BookingStateMachine.canTransition(BookingStatus.ACTIVE, BookingAction.CHECK_IN));
        assertFalse(BookingStateMachine.canTransition(BookingStatus.APPROVED, BookingAction.CHECK_IN));
        assertFalse(BookingStateMachine.canTransition(BookingStatus.PENDING, BookingAction.CHECK_IN));
    }
}
