package com.flagship.equipment_booking.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A change-history entry waiting to be published to Kafka.
 *
 * Entries are written to the outbox table right after the record store
 * write they describe, then published asynchronously by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String entityType;         // e.g., "booking"
    String entityId;           // record store id
    String action;             // e.g., "checked-out"
    String payload;            // JSON change entry
    Instant createdAt;
    Instant publishedAt;       // null if not yet published
    int retryCount;
    String lastError;

    public static OutboxEvent create(String entityType, String entityId,
                                     String action, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            entityType,
            entityId,
            action,
            payload,
            Instant.now(),
            null,
            0,
            null
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
