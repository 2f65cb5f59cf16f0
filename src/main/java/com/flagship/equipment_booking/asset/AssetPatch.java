package com.flagship.equipment_booking.asset;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Partial update of an asset. Null members leave the current value alone;
 * the clear flags reset the corresponding reference to null.
 *
 * {@code fieldValues} addresses fields by field key (descriptive or
 * customField:); a null value in it clears that field.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AssetPatch {
    AssetStatus status;
    Boolean bookable;

    InUseBy inUseBy;
    boolean clearInUseBy;

    String currentBookingId;
    boolean clearCurrentBookingId;

    AssetGroupRef assetGroup;
    boolean clearAssetGroup;

    Map<String, FieldSource> fieldSources;
    Map<String, Object> fieldValues;
    List<String> childAssetIds;

    /**
     * Patch that returns held assets to the shelf: available, no holder,
     * no booking.
     */
    public static AssetPatch release() {
        return AssetPatch.builder()
            .status(AssetStatus.AVAILABLE)
            .clearInUseBy(true)
            .clearCurrentBookingId(true)
            .build();
    }

    public Asset applyTo(Asset asset) {
        Asset.AssetBuilder builder = asset.toBuilder();

        if (status != null) {
            builder.status(status);
        }
        if (bookable != null) {
            builder.bookable(bookable);
        }
        if (clearInUseBy) {
            builder.inUseBy(null);
        } else if (inUseBy != null) {
            builder.inUseBy(inUseBy);
        }
        if (clearCurrentBookingId) {
            builder.currentBookingId(null);
        } else if (currentBookingId != null) {
            builder.currentBookingId(currentBookingId);
        }
        if (clearAssetGroup) {
            builder.assetGroup(null);
        } else if (assetGroup != null) {
            builder.assetGroup(assetGroup);
        }
        if (fieldSources != null) {
            builder.fieldSources(Map.copyOf(fieldSources));
        }
        if (childAssetIds != null) {
            builder.childAssetIds(List.copyOf(childAssetIds));
        }

        Asset patched = builder.build();
        if (fieldValues != null) {
            for (Map.Entry<String, Object> entry : fieldValues.entrySet()) {
                patched = patched.withFieldValue(entry.getKey(), entry.getValue());
            }
        }
        return patched;
    }
}
