package com.flagship.equipment_booking.inventory;

import com.flagship.equipment_booking.asset.Asset;
import com.flagship.equipment_booking.asset.AssetPatch;
import com.flagship.equipment_booking.booking.Booking;
import com.flagship.equipment_booking.exception.ResourceNotFoundException;
import com.flagship.equipment_booking.group.AssetGroup;
import com.flagship.equipment_booking.kit.Kit;
import com.flagship.equipment_booking.store.Actor;
import com.flagship.equipment_booking.store.RecordStoreClient;
import com.flagship.equipment_booking.store.StoredRecord;
import com.flagship.equipment_booking.store.codec.RecordCodec;
import com.flagship.equipment_booking.store.codec.RecordKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * {@link InventoryStore} over the generic record store.
 *
 * The record store only lists whole categories, so filters are applied
 * here after decoding.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordInventoryStore implements InventoryStore {

    private final RecordStoreClient recordStore;
    private final RecordCodec codec;

    // ==================== Assets ====================

    @Override
    public Optional<Asset> findAsset(String id) {
        return find(RecordKind.ASSET, id, Asset.class);
    }

    @Override
    public List<Asset> getAssets(AssetFilter filter) {
        return list(RecordKind.ASSET, Asset.class).stream()
            .filter(filter::matches)
            .toList();
    }

    @Override
    public Asset createAsset(Asset asset) {
        return create(RecordKind.ASSET, asset, Asset.class);
    }

    @Override
    public Asset updateAsset(String id, AssetPatch patch) {
        Asset current = getAsset(id);
        return update(RecordKind.ASSET, id, patch.applyTo(current), Asset.class);
    }

    // ==================== Bookings ====================

    @Override
    public List<Booking> getBookings(BookingFilter filter) {
        return list(RecordKind.BOOKING, Booking.class).stream()
            .filter(filter::matches)
            .toList();
    }

    @Override
    public Optional<Booking> findBooking(String id) {
        return find(RecordKind.BOOKING, id, Booking.class);
    }

    @Override
    public Booking createBookingRecord(Booking booking) {
        return create(RecordKind.BOOKING, booking, Booking.class);
    }

    @Override
    public Booking updateBookingRecord(String id, Booking booking) {
        return update(RecordKind.BOOKING, id, booking, Booking.class);
    }

    @Override
    public void deleteBookingRecord(String id) {
        recordStore.deleteRecord(RecordKind.BOOKING.category(), id);
    }

    // ==================== Asset groups ====================

    @Override
    public Optional<AssetGroup> getAssetGroup(String id) {
        return find(RecordKind.ASSET_GROUP, id, AssetGroup.class);
    }

    @Override
    public List<AssetGroup> getAssetGroups() {
        return list(RecordKind.ASSET_GROUP, AssetGroup.class);
    }

    @Override
    public AssetGroup createAssetGroup(AssetGroup group) {
        return create(RecordKind.ASSET_GROUP, group, AssetGroup.class);
    }

    @Override
    public AssetGroup updateAssetGroup(String id, UnaryOperator<AssetGroup> change) {
        AssetGroup current = getAssetGroup(id)
            .orElseThrow(() -> new ResourceNotFoundException("Asset group", id));
        return update(RecordKind.ASSET_GROUP, id, change.apply(current), AssetGroup.class);
    }

    @Override
    public void deleteAssetGroup(String id) {
        recordStore.deleteRecord(RecordKind.ASSET_GROUP.category(), id);
    }

    // ==================== Kits ====================

    @Override
    public Optional<Kit> getKit(String id) {
        return find(RecordKind.KIT, id, Kit.class);
    }

    @Override
    public List<Kit> getKits() {
        return list(RecordKind.KIT, Kit.class);
    }

    @Override
    public Kit createKit(Kit kit) {
        return create(RecordKind.KIT, kit, Kit.class);
    }

    @Override
    public Actor getCurrentActor() {
        return recordStore.getCurrentActor();
    }

    // ==================== Helpers ====================

    private <T> Optional<T> find(RecordKind kind, String id, Class<T> type) {
        return recordStore.getRecord(kind.category(), id)
            .map(record -> codec.decode(kind, record, type));
    }

    private <T> List<T> list(RecordKind kind, Class<T> type) {
        List<StoredRecord> records = recordStore.listRecords(kind.category());
        log.debug("Loaded {} {} records", records.size(), kind.tag());
        return records.stream()
            .map(record -> codec.decode(kind, record, type))
            .toList();
    }

    private <T> T create(RecordKind kind, T entity, Class<T> type) {
        StoredRecord created = recordStore.createRecord(kind.category(), codec.encode(kind, entity));
        return codec.decode(kind, created, type);
    }

    private <T> T update(RecordKind kind, String id, T entity, Class<T> type) {
        StoredRecord updated = recordStore.updateRecord(kind.category(), id, codec.encode(kind, entity));
        return codec.decode(kind, updated, type);
    }
}
