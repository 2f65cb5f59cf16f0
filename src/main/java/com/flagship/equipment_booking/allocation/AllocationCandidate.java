package com.flagship.equipment_booking.allocation;

import com.flagship.equipment_booking.asset.Asset;
import com.flagship.equipment_booking.asset.AssetStatus;
import lombok.Builder;
import lombok.Value;

/**
 * A concrete item the allocator may hand out, with its availability for
 * the requested window already decided.
 */
@Value
@Builder(toBuilder = true)
public class AllocationCandidate {
    String id;
    String assetNumber;
    AssetStatus status;
    boolean bookable;
    boolean available;
    String currentBookingId;

    public static AllocationCandidate from(Asset asset, boolean available) {
        return AllocationCandidate.builder()
            .id(asset.getId())
            .assetNumber(asset.getAssetNumber())
            .status(asset.getStatus())
            .bookable(asset.isBookable())
            .available(available)
            .currentBookingId(asset.getCurrentBookingId())
            .build();
    }
}
