package com.flagship.equipment_booking.kit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.util.List;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class KitAvailabilityResult {
    boolean available;
    List<String> unavailableAssets;
    String reason;

    public static KitAvailabilityResult ofAvailable() {
        return new KitAvailabilityResult(true, null, null);
    }

    public static KitAvailabilityResult unavailable(String reason) {
        return new KitAvailabilityResult(false, null, reason);
    }

    public static KitAvailabilityResult unavailable(List<String> unavailableAssets, String reason) {
        return new KitAvailabilityResult(false, List.copyOf(unavailableAssets), reason);
    }
}
