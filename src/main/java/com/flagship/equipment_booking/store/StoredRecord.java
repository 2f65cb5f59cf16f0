package com.flagship.equipment_booking.store;

import lombok.Value;

import java.time.Instant;

/**
 * A record as the record store sees it: a category, an opaque JSON payload and
 * the metadata the store assigns on write.
 */
@Value
public class StoredRecord {
    String id;
    String category;
    String payload;
    Instant createdAt;
    Instant modifiedAt;
}
