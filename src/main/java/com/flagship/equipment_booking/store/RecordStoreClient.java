package com.flagship.equipment_booking.store;

import java.util.List;
import java.util.Optional;

/**
 * CRUD over opaque JSON records grouped by category.
 *
 * The store knows nothing about assets or bookings. It assigns ids and
 * timestamps, keeps payloads verbatim and offers no multi-record transaction.
 */
public interface RecordStoreClient {

    /**
     * Lists all records of a category in write order.
     */
    List<StoredRecord> listRecords(String category);

    Optional<StoredRecord> getRecord(String category, String id);

    StoredRecord createRecord(String category, String payload);

    /**
     * Replaces the payload of an existing record.
     *
     * @throws com.flagship.equipment_booking.exception.ResourceNotFoundException if no such record exists
     */
    StoredRecord updateRecord(String category, String id, String payload);

    /**
     * Removes a record. Deleting a missing record is a no-op.
     */
    void deleteRecord(String category, String id);

    Actor getCurrentActor();
}
