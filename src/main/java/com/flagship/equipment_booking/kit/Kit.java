package com.flagship.equipment_booking.kit;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * A bundle of equipment booked as one unit. Fixed kits list concrete
 * assets, flexible kits list pool requirements.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Kit {
    String id;
    String name;
    String description;
    String location;
    KitType type;
    @Builder.Default
    List<BoundAsset> boundAssets = List.of();
    @Builder.Default
    List<PoolRequirement> poolRequirements = List.of();
    Instant createdAt;
}
