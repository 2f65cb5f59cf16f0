package com.flagship.equipment_booking.store.codec;

import java.util.Arrays;

/**
 * Entity kinds persisted through the record store, with the store category
 * each lives in and the schema version new records are written with.
 */
public enum RecordKind {
    ASSET("asset", "__assets__", 2),
    BOOKING("booking", "__bookings__", 2),
    KIT("kit", "__kits__", 1),
    ASSET_GROUP("asset-group", "__asset_groups__", 2);

    private final String tag;
    private final String category;
    private final int currentVersion;

    RecordKind(String tag, String category, int currentVersion) {
        this.tag = tag;
        this.category = category;
        this.currentVersion = currentVersion;
    }

    public String tag() {
        return tag;
    }

    public String category() {
        return category;
    }

    public int currentVersion() {
        return currentVersion;
    }

    public static RecordKind fromTag(String tag) {
        return Arrays.stream(values())
            .filter(kind -> kind.tag.equals(tag))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Unknown record kind: " + tag));
    }
}
