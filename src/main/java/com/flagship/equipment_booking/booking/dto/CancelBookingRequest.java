package com.flagship.equipment_booking.booking.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CancelBookingRequest {
    String reason;
}
