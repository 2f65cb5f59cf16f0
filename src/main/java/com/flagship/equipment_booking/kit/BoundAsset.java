package com.flagship.equipment_booking.kit;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A specific asset that is part of a fixed kit. {@code inherits} marks the
 * fields the asset takes over from the kit.
 */
@Value
@Builder
@Jacksonized
public class BoundAsset {
    String assetId;
    String assetNumber;
    @Builder.Default
    Map<String, Boolean> inherits = Map.of();
}
