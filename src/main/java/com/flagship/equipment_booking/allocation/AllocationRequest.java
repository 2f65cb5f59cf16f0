package com.flagship.equipment_booking.allocation;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Which items of a multi-unit asset would be handed out for a window.
 */
@Value
@Builder
@Jacksonized
public class AllocationRequest {

    @NotBlank(message = "Parent asset id is required")
    String parentAssetId;

    @Min(value = 1, message = "quantity must be at least 1")
    int quantity;

    @NotNull(message = "startDate is required")
    Instant startDate;

    @NotNull(message = "endDate is required")
    Instant endDate;

    List<String> excludeIds;
}
