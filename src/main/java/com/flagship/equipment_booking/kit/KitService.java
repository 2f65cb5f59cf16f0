package com.flagship.equipment_booking.kit;

import com.flagship.equipment_booking.asset.Asset;
import com.flagship.equipment_booking.asset.AssetStatus;
import com.flagship.equipment_booking.exception.ResourceNotFoundException;
import com.flagship.equipment_booking.history.ChangeEntry;
import com.flagship.equipment_booking.history.ChangeHistoryRecorder;
import com.flagship.equipment_booking.inventory.InventoryStore;
import com.flagship.equipment_booking.store.Actor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Kit creation and lookup.
 *
 * A fixed kit needs at least one bound asset and every bound asset must
 * exist and be available when the kit is assembled. A flexible kit needs at
 * least one pool requirement, each asking for one or more assets.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class KitService {

    private final InventoryStore inventoryStore;
    private final ChangeHistoryRecorder historyRecorder;
    private final Clock clock;

    public Kit createKit(Kit kit) {
        if (kit.getName() == null || kit.getName().isBlank()) {
            throw new IllegalArgumentException("Kit name is required");
        }
        if (kit.getType() == null) {
            throw new IllegalArgumentException("Kit type is required");
        }

        if (kit.getType() == KitType.FIXED) {
            validateBoundAssets(kit.getBoundAssets());
        } else {
            validatePoolRequirements(kit.getPoolRequirements());
        }

        Kit created = inventoryStore.createKit(kit.toBuilder().id(null).createdAt(null).build());

        Actor actor = inventoryStore.getCurrentActor();
        historyRecorder.record(ChangeEntry.of("kit", created.getId(), "created", actor, clock.instant())
            .toBuilder().entityName(created.getName()).build());

        log.info("Kit created: kitId={}, type={}", created.getId(), created.getType().value());
        return created;
    }

    public Kit getKit(String id) {
        return inventoryStore.getKit(id)
            .orElseThrow(() -> new ResourceNotFoundException("Kit", id));
    }

    public List<Kit> listKits() {
        return inventoryStore.getKits();
    }

    private void validateBoundAssets(List<BoundAsset> boundAssets) {
        if (boundAssets == null || boundAssets.isEmpty()) {
            throw new IllegalArgumentException("Fixed kit must have at least one bound asset");
        }
        for (BoundAsset bound : boundAssets) {
            if (bound.getAssetId() == null) {
                throw new IllegalArgumentException("Bound asset id is required");
            }
            Asset asset = inventoryStore.getAsset(bound.getAssetId());
            if (asset.getStatus() != AssetStatus.AVAILABLE) {
                throw new IllegalStateException(String.format(
                    "Asset %s is not available (status: %s)", asset.getAssetNumber(), asset.getStatus().value()));
            }
        }
    }

    private void validatePoolRequirements(List<PoolRequirement> pools) {
        if (pools == null || pools.isEmpty()) {
            throw new IllegalArgumentException("Flexible kit must have at least one pool requirement");
        }
        for (PoolRequirement pool : pools) {
            if (pool.getAssetTypeId() == null) {
                throw new IllegalArgumentException("Pool requirement asset type is required");
            }
            if (pool.getQuantity() < 1) {
                throw new IllegalArgumentException(String.format(
                    "Pool requirement %s quantity must be at least 1", pool.displayName()));
            }
        }
    }
}
