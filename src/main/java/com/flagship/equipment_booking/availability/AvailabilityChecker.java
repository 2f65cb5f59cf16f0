package com.flagship.equipment_booking.availability;

import com.flagship.equipment_booking.booking.Booking;
import com.flagship.equipment_booking.booking.BookingStatus;
import com.flagship.equipment_booking.inventory.BookingFilter;
import com.flagship.equipment_booking.inventory.InventoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * Decides whether an asset is free for a window.
 *
 * Only approved and active bookings block. Windows overlap when
 * existingStart <= end and existingEnd >= start, so touching windows
 * conflict. Pure read, no error conditions.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AvailabilityChecker {

    private final InventoryStore inventoryStore;

    public boolean isAvailable(String assetId, Instant start, Instant end) {
        return isAvailable(assetId, start, end, null);
    }

    /**
     * Same as {@link #isAvailable(String, Instant, Instant)} but ignores one
     * booking, so a booking can be checked against everything but itself.
     */
    public boolean isAvailable(String assetId, Instant start, Instant end, String excludeBookingId) {
        List<Booking> blocking = findBlockingBookings(assetId, TimeWindow.of(start, end), excludeBookingId);
        if (!blocking.isEmpty()) {
            log.debug("Asset {} blocked between {} and {} by {} booking(s)", assetId, start, end, blocking.size());
        }
        return blocking.isEmpty();
    }

    public List<Booking> findBlockingBookings(String assetId, TimeWindow window, String excludeBookingId) {
        BookingFilter filter = BookingFilter.builder()
            .assetId(assetId)
            .statuses(BookingStatus.BLOCKING)
            .window(window)
            .build();

        return inventoryStore.getBookings(filter).stream()
            .filter(booking -> excludeBookingId == null || !excludeBookingId.equals(booking.getId()))
            .toList();
    }
}
