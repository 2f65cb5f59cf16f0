package com.flagship.equipment_booking.group.dto;

import com.flagship.equipment_booking.asset.AssetPatch;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class BulkUpdateMembersRequest {
    AssetPatch patch;
    boolean clearOverrides;
}
