package com.flagship.equipment_booking.booking;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * What a booking reserves: a single asset (possibly a multi-unit parent),
 * a kit, or one member of an asset group.
 */
@Value
@Builder
@Jacksonized
public class BookingTarget {
    BookingTargetType type;
    String assetId;
    String kitId;
    String groupId;

    public static BookingTarget asset(String assetId) {
        return new BookingTarget(BookingTargetType.ASSET, assetId, null, null);
    }

    public static BookingTarget kit(String kitId) {
        return new BookingTarget(BookingTargetType.KIT, null, kitId, null);
    }

    public static BookingTarget groupMember(String groupId, String assetId) {
        return new BookingTarget(BookingTargetType.GROUP_MEMBER, assetId, null, groupId);
    }
}
