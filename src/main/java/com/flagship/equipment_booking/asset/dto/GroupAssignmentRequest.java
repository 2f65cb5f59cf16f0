package com.flagship.equipment_booking.asset.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Target group of an asset. A null groupId removes the asset from its group.
 */
@Value
@Builder
@Jacksonized
public class GroupAssignmentRequest {
    String groupId;
}
