package com.flagship.equipment_booking.allocation;

import com.flagship.equipment_booking.asset.AssetStatus;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks concrete items for a quantity request.
 *
 * Candidates keep their input order (callers sort by asset number), so the
 * same input always yields the same allocation.
 */
@Component
public class QuantityAllocator {

    public AllocationResult allocate(int quantity,
                                     String parentAssetId,
                                     List<AllocationCandidate> candidates,
                                     Collection<String> excludeIds) {
        if (quantity < 1) {
            throw new IllegalArgumentException("quantity must be at least 1");
        }

        Set<String> excluded = excludeIds == null ? Set.of() : new HashSet<>(excludeIds);

        List<AllocationCandidate> eligible = candidates.stream()
            .filter(candidate -> isEligible(candidate, excluded))
            .toList();

        if (eligible.size() >= quantity) {
            return new AllocationResult(AllocationStatus.FULFILLED, parentAssetId,
                eligible.subList(0, quantity), null);
        }

        return new AllocationResult(AllocationStatus.SHORTAGE, parentAssetId,
            eligible, Shortage.of(quantity, eligible.size()));
    }

    private boolean isEligible(AllocationCandidate candidate, Set<String> excluded) {
        return candidate.isBookable()
            && candidate.isAvailable()
            && !excluded.contains(candidate.getId())
            && candidate.getCurrentBookingId() == null
            && candidate.getStatus() == AssetStatus.AVAILABLE;
    }
}
