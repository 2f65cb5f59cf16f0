package com.flagship.equipment_booking.booking;

import lombok.Value;

import java.util.List;

/**
 * Per-asset outcome of a group booking. Individual failures are reported
 * here instead of being thrown.
 */
@Value
public class GroupBookingResult {
    List<Success> successes;
    List<Failure> failures;

    @Value
    public static class Success {
        String assetId;
        Booking booking;
    }

    @Value
    public static class Failure {
        String assetId;
        String error;
    }
}
