package com.flagship.equipment_booking.booking.dto;

import com.flagship.equipment_booking.booking.BookingCreate;
import com.flagship.equipment_booking.booking.BookingMode;
import com.flagship.equipment_booking.booking.BookingStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

@Value
@Builder
@Jacksonized
public class GroupBookingTemplate {
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
