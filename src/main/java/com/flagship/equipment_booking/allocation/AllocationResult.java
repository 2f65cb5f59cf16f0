package com.flagship.equipment_booking.allocation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.util.List;

/**
 * Allocator outcome. On shortage {@code allocated} still holds every
 * eligible candidate so callers can fulfil partially.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AllocationResult {
    AllocationStatus status;
    String parentAssetId;
    List<AllocationCandidate> allocated;
    Shortage shortage;

    @JsonIgnore
    public boolean isFulfilled() {
        return status == AllocationStatus.FULFILLED;
    }

    public List<String> allocatedIds() {
        return allocated.stream().map(AllocationCandidate::getId).toList();
    }
}
