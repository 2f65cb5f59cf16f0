package com.flagship.equipment_booking.booking.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Books several members of one asset group with a shared template. The
 * template's target is ignored.
 */
@Value
@Builder
@Jacksonized
public class GroupBookingRequest {

    @NotEmpty(message = "At least one asset id is required")
    List<String> assetIds;

    @NotNull(message = "booking is required")
    @Valid
    GroupBookingTemplate booking;

    boolean stopOnError;
}
