package com.flagship.equipment_booking.asset;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Back-reference from an asset to the group that lists it as a member.
 */
@Value
@Builder
@Jacksonized
public class AssetGroupRef {
    String id;
    String groupNumber;
    String name;
}
