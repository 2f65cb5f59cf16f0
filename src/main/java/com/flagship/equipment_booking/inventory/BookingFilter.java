package com.flagship.equipment_booking.inventory;

import com.flagship.equipment_booking.availability.TimeWindow;
import com.flagship.equipment_booking.booking.Booking;
import com.flagship.equipment_booking.booking.BookingStatus;
import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * Criteria for {@link InventoryStore#getBookings}. Null members match anything.
 *
 * {@code assetId} matches every booking that references the asset, whether
 * as its target (including a multi-unit parent) or as an allocated item. {@code window} keeps bookings whose
 * window overlaps it.
 */
@Value
@Builder
public class BookingFilter {
    String assetId;
    String kitId;
    String groupId;
    Set<BookingStatus> statuses;
    TimeWindow window;
    String requestKey;

    public static BookingFilter all() {
        return BookingFilter.builder().build();
    }

    public boolean matches(Booking booking) {
        if (assetId != null && !booking.references(assetId)) {
            return false;
        }
        if (kitId != null && (booking.getTarget() == null || !kitId.equals(booking.getTarget().getKitId()))) {
            return false;
        }
        if (groupId != null && (booking.getTarget() == null || !groupId.equals(booking.getTarget().getGroupId()))) {
            return false;
        }
        if (statuses != null && !statuses.isEmpty() && !statuses.contains(booking.getStatus())) {
            return false;
        }
        if (requestKey != null && !requestKey.equals(booking.getRequestKey())) {
            return false;
        }
        return window == null || window.overlaps(booking.window());
    }
}
