package com.flagship.equipment_booking.group.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class MembershipRequest {

    @NotBlank(message = "Asset id is required")
    String assetId;
}
