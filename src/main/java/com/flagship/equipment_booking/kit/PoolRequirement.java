package com.flagship.equipment_booking.kit;

import com.flagship.equipment_booking.asset.Asset;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A flexible kit's need for {@code quantity} assets of one type whose
 * fields equal every entry of {@code filters}.
 */
@Value
@Builder
@Jacksonized
public class PoolRequirement {
    String assetTypeId;
    String assetTypeName;
    int quantity;
    @Builder.Default
    Map<String, Object> filters = Map.of();

    public String displayName() {
        return assetTypeName != null && !assetTypeName.isBlank() ? assetTypeName : assetTypeId;
    }

    public boolean matches(Asset asset) {
        if (assetTypeId == null || !assetTypeId.equals(asset.getAssetTypeId())) {
            return false;
        }
        return filters.entrySet().stream()
            .allMatch(filter -> asset.matchesFilter(filter.getKey(), filter.getValue()));
    }
}
