package com.flagship.equipment_booking.booking.dto;

import com.flagship.equipment_booking.booking.BookingCreate;
import com.flagship.equipment_booking.booking.BookingMode;
import com.flagship.equipment_booking.booking.BookingStatus;
import com.flagship.equipment_booking.booking.BookingTarget;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

@Value
@Builder
@Jacksonized
public class CreateBookingRequest {

    @NotNull(message = "target is required: a booking needs an asset or a kit")
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

    public BookingCreate toCommand(String requestKey) {
        return BookingCreate.builder()
            .target(target)
            .quantity(quantity)
            .bookingMode(bookingMode)
            .startDate(startDate)
            .endDate(endDate)
            .date(date)
            .startTime(startTime)
            .endTime(endTime)
            .purpose(purpose)
            .notes(notes)
            .initialStatus(initialStatus)
            .requestKey(requestKey)
            .build();
    }
}
