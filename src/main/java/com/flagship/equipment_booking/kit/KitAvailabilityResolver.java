package com.flagship.equipment_booking.kit;

import com.flagship.equipment_booking.asset.Asset;
import com.flagship.equipment_booking.availability.AvailabilityChecker;
import com.flagship.equipment_booking.exception.ResourceNotFoundException;
import com.flagship.equipment_booking.inventory.AssetFilter;
import com.flagship.equipment_booking.inventory.InventoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Answers "can this kit be booked for this window?".
 *
 * Fixed kits: every bound asset must pass the availability check; all
 * failures are reported. Flexible kits: each pool must have enough free
 * matching assets; the first short pool ends the check.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class KitAvailabilityResolver {

    private final InventoryStore inventoryStore;
    private final AvailabilityChecker availabilityChecker;

    /**
     * @throws ResourceNotFoundException if the kit does not exist
     */
    public KitAvailabilityResult isKitAvailable(String kitId, Instant start, Instant end) {
        Kit kit = inventoryStore.getKit(kitId)
            .orElseThrow(() -> new ResourceNotFoundException("Kit", kitId));
        return check(kit, start, end);
    }

    public KitAvailabilityResult check(Kit kit, Instant start, Instant end) {
        KitAvailabilityResult result = kit.getType() == KitType.FIXED
            ? checkFixedKit(kit, start, end)
            : checkFlexibleKit(kit, start, end);

        if (!result.isAvailable()) {
            log.debug("Kit {} not available between {} and {}: {}", kit.getId(), start, end, result.getReason());
        }
        return result;
    }

    /**
     * Assets of the pool's type that satisfy all of its filters, in store order.
     */
    public List<Asset> poolMembers(PoolRequirement pool) {
        return inventoryStore.getAssets(AssetFilter.ofType(pool.getAssetTypeId())).stream()
            .filter(pool::matches)
            .toList();
    }

    private KitAvailabilityResult checkFixedKit(Kit kit, Instant start, Instant end) {
        if (kit.getBoundAssets().isEmpty()) {
            return KitAvailabilityResult.unavailable("Fixed kit has no bound assets");
        }

        List<String> unavailable = new ArrayList<>();
        for (BoundAsset bound : kit.getBoundAssets()) {
            if (!availabilityChecker.isAvailable(bound.getAssetId(), start, end)) {
                unavailable.add(bound.getAssetId());
            }
        }

        if (unavailable.isEmpty()) {
            return KitAvailabilityResult.ofAvailable();
        }
        return KitAvailabilityResult.unavailable(unavailable, unavailable.size() + " asset(s) unavailable");
    }

    private KitAvailabilityResult checkFlexibleKit(Kit kit, Instant start, Instant end) {
        if (kit.getPoolRequirements().isEmpty()) {
            return KitAvailabilityResult.unavailable("Flexible kit has no pool requirements");
        }

        for (PoolRequirement pool : kit.getPoolRequirements()) {
            long free = poolMembers(pool).stream()
                .filter(asset -> availabilityChecker.isAvailable(asset.getId(), start, end))
                .count();

            if (free < pool.getQuantity()) {
                return KitAvailabilityResult.unavailable(String.format(
                    "Insufficient assets in pool %s: need %d, only %d available",
                    pool.displayName(), pool.getQuantity(), free));
            }
        }
        return KitAvailabilityResult.ofAvailable();
    }
}
