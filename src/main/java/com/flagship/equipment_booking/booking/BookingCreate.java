package com.flagship.equipment_booking.booking;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Input of {@link BookingService#create}.
 *
 * Date-range bookings give startDate/endDate. Single-day bookings give
 * date plus optional startTime/endTime, or startDate/endDate directly.
 * initialStatus may be pending (default) or approved.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class BookingCreate {
    BookingTarget target;
    Integer quantity;
    BookingMode bookingMode;
    Instant startDate;
    Instant endDate;
    LocalDate date;
    LocalTime startTime;
    LocalTime endTime;
    String purpose;
    String notes;
    BookingStatus initialStatus;
    String requestKey;
}
