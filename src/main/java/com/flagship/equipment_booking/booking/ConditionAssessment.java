package com.flagship.equipment_booking.booking;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Condition of the equipment recorded at check-out or check-in.
 */
@Value
@Builder
@Jacksonized
public class ConditionAssessment {
    ConditionRating rating;
    String notes;
    @Builder.Default
    List<String> photos = List.of();
}
