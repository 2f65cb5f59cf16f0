package com.flagship.equipment_booking.asset;

import com.flagship.equipment_booking.booking.BookingStatus;
import com.flagship.equipment_booking.exception.ResourceNotFoundException;
import com.flagship.equipment_booking.history.ChangeEntry;
import com.flagship.equipment_booking.history.ChangeHistoryRecorder;
import com.flagship.equipment_booking.history.FieldChange;
import com.flagship.equipment_booking.inventory.AssetFilter;
import com.flagship.equipment_booking.inventory.BookingFilter;
import com.flagship.equipment_booking.inventory.InventoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Asset creation, lookup and logical deletion.
 *
 * Group membership is not set here; it is maintained by the asset group
 * operations so both sides of the relationship move together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssetService {

    private final InventoryStore inventoryStore;
    private final ChangeHistoryRecorder historyRecorder;
    private final Clock clock;

    /**
     * Creates an asset. A parent id links the new asset into the parent's
     * child list, which turns the parent into a multi-unit asset.
     */
    public Asset createAsset(Asset draft) {
        if (draft.getAssetNumber() == null || draft.getAssetNumber().isBlank()) {
            throw new IllegalArgumentException("Asset number is required");
        }

        boolean numberTaken = inventoryStore.getAssets(AssetFilter.all()).stream()
            .anyMatch(existing -> draft.getAssetNumber().equals(existing.getAssetNumber()));
        if (numberTaken) {
            throw new IllegalArgumentException("Asset number " + draft.getAssetNumber() + " is already in use");
        }

        Asset parent = draft.getParentAssetId() == null ? null : inventoryStore.getAsset(draft.getParentAssetId());

        Asset created = inventoryStore.createAsset(draft.toBuilder()
            .id(null)
            .createdAt(null)
            .status(draft.getStatus() == null ? AssetStatus.AVAILABLE : draft.getStatus())
            .childAssetIds(List.of())
            .assetGroup(null)
            .fieldSources(Map.of())
            .inUseBy(null)
            .currentBookingId(null)
            .build());

        if (parent != null) {
            List<String> children = new ArrayList<>(parent.getChildAssetIds());
            children.add(created.getId());
            inventoryStore.updateAsset(parent.getId(), AssetPatch.builder().childAssetIds(children).build());
        }

        historyRecorder.record(ChangeEntry.of("asset", created.getId(), "created",
                inventoryStore.getCurrentActor(), clock.instant())
            .toBuilder().entityName(created.getAssetNumber()).build());

        log.info("Asset created: assetId={}, assetNumber={}", created.getId(), created.getAssetNumber());
        return created;
    }

    public Asset getAsset(String id) {
        return inventoryStore.getAsset(id);
    }

    public List<Asset> listAssets(AssetFilter filter) {
        return inventoryStore.getAssets(filter);
    }

    /**
     * Marks an asset deleted. The record stays in the store so bookings and
     * history that reference it still resolve.
     *
     * @throws IllegalStateException while approved or active bookings hold the asset
     */
    public Asset deleteAsset(String id) {
        Asset asset = inventoryStore.findAsset(id)
            .orElseThrow(() -> new ResourceNotFoundException("Asset", id));

        if (asset.getStatus() == AssetStatus.DELETED) {
            return asset;
        }

        BookingFilter holding = BookingFilter.builder()
            .assetId(id)
            .statuses(BookingStatus.BLOCKING)
            .build();
        if (!inventoryStore.getBookings(holding).isEmpty()) {
            throw new IllegalStateException(String.format(
                "Cannot delete asset %s while it has approved or active bookings", asset.getAssetNumber()));
        }

        Asset deleted = inventoryStore.updateAsset(id, AssetPatch.builder().status(AssetStatus.DELETED).build());

        historyRecorder.record(ChangeEntry.of("asset", id, "deleted", inventoryStore.getCurrentActor(), clock.instant())
            .toBuilder()
            .entityName(asset.getAssetNumber())
            .changes(List.of(FieldChange.of("status", asset.getStatus().value(), AssetStatus.DELETED.value())))
            .build());

        log.info("Asset deleted: assetId={}", id);
        return deleted;
    }
}
