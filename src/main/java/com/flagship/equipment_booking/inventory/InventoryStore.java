package com.flagship.equipment_booking.inventory;

import com.flagship.equipment_booking.asset.Asset;
import com.flagship.equipment_booking.asset.AssetPatch;
import com.flagship.equipment_booking.booking.Booking;
import com.flagship.equipment_booking.exception.ResourceNotFoundException;
import com.flagship.equipment_booking.group.AssetGroup;
import com.flagship.equipment_booking.kit.Kit;
import com.flagship.equipment_booking.store.Actor;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Typed access to the entities the booking engine reads and writes.
 *
 * Every method is a single read or a single-record write against the
 * record store. Nothing here is atomic across records.
 */
public interface InventoryStore {

    // ==================== Assets ====================

    Optional<Asset> findAsset(String id);

    default Asset getAsset(String id) {
        return findAsset(id).orElseThrow(() -> new ResourceNotFoundException("Asset", id));
    }

    List<Asset> getAssets(AssetFilter filter);

    Asset createAsset(Asset asset);

    /**
     * Reads the asset, applies the patch and writes it back.
     *
     * @throws ResourceNotFoundException if the asset does not exist
     */
    Asset updateAsset(String id, AssetPatch patch);

    // ==================== Bookings ====================

    List<Booking> getBookings(BookingFilter filter);

    Optional<Booking> findBooking(String id);

    default Booking getBooking(String id) {
        return findBooking(id).orElseThrow(() -> new ResourceNotFoundException("Booking", id));
    }

    Booking createBookingRecord(Booking booking);

    Booking updateBookingRecord(String id, Booking booking);

    /**
     * Hard-deletes a booking record. Unknown ids are ignored.
     */
    void deleteBookingRecord(String id);

    // ==================== Asset groups ====================

    Optional<AssetGroup> getAssetGroup(String id);

    List<AssetGroup> getAssetGroups();

    AssetGroup createAssetGroup(AssetGroup group);

    /**
     * Reads the group, applies {@code change} and writes the result back.
     */
    AssetGroup updateAssetGroup(String id, UnaryOperator<AssetGroup> change);

    /**
     * Hard-deletes a group record. Unknown ids are ignored.
     */
    void deleteAssetGroup(String id);

    // ==================== Kits ====================

    Optional<Kit> getKit(String id);

    List<Kit> getKits();

    Kit createKit(Kit kit);

    // ==================== Audit ====================

    Actor getCurrentActor();
}
