package com.flagship.equipment_booking.allocation;

import lombok.Value;

@Value
public class Shortage {
    int requested;
    int available;
    int missing;
    String message;

    static Shortage of(int requested, int available) {
        int missing = requested - available;
        return new Shortage(requested, available, missing, String.format(
            "Requested %d items but only %d available (%d missing).", requested, available, missing));
    }
}
