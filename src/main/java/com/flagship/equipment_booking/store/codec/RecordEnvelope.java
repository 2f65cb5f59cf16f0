package com.flagship.equipment_booking.store.codec;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;

/**
 * The tagged shape every payload is stored in:
 * {@code {"schemaVersion": n, "kind": "...", "data": {...}}}.
 */
@Value
public class RecordEnvelope {
    int schemaVersion;
    RecordKind kind;
    ObjectNode data;

    public RecordEnvelope withData(int version, ObjectNode migrated) {
        return new RecordEnvelope(version, kind, migrated);
    }
}
