package com.flagship.equipment_booking.inventory;

import com.flagship.equipment_booking.asset.Asset;
import com.flagship.equipment_booking.asset.AssetStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Criteria for {@link InventoryStore#getAssets}. Null members match anything.
 */
@Value
@Builder
public class AssetFilter {
    String assetTypeId;
    String parentAssetId;
    AssetStatus status;
    String groupId;

    public static AssetFilter all() {
        return AssetFilter.builder().build();
    }

    public static AssetFilter ofType(String assetTypeId) {
        return AssetFilter.builder().assetTypeId(assetTypeId).build();
    }

    public static AssetFilter childrenOf(String parentAssetId) {
        return AssetFilter.builder().parentAssetId(parentAssetId).build();
    }

    public boolean matches(Asset asset) {
        if (assetTypeId != null && !assetTypeId.equals(asset.getAssetTypeId())) {
            return false;
        }
        if (parentAssetId != null && !parentAssetId.equals(asset.getParentAssetId())) {
            return false;
        }
        if (status != null && status != asset.getStatus()) {
            return false;
        }
        return groupId == null
            || (asset.getAssetGroup() != null && groupId.equals(asset.getAssetGroup().getId()));
    }
}
