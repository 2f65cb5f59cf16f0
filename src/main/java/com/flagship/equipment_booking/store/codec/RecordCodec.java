package com.flagship.equipment_booking.store.codec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.equipment_booking.store.StoredRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Converts domain objects to and from record store payloads.
 *
 * Payloads are written as a {@link RecordEnvelope}. On read, untagged
 * payloads are treated as schema version 1 and every payload is migrated
 * step by step up to the kind's current version before it is bound.
 * The record id and creation time are owned by the store: they are stripped
 * on write and injected from the {@link StoredRecord} on read.
 */
@Component
@Slf4j
public class RecordCodec {

    static final String SCHEMA_VERSION = "schemaVersion";
    static final String KIND = "kind";
    static final String DATA = "data";

    private final ObjectMapper mapper;
    private final RecordMigrations migrations;

    public RecordCodec(ObjectMapper objectMapper) {
        this(objectMapper, RecordMigrations.standard());
    }

    RecordCodec(ObjectMapper objectMapper, RecordMigrations migrations) {
        this.mapper = objectMapper.copy()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.migrations = migrations;
    }

    public String encode(RecordKind kind, Object entity) {
        ObjectNode data = mapper.valueToTree(entity);
        data.remove("id");
        data.remove("createdAt");

        ObjectNode envelope = mapper.createObjectNode();
        envelope.put(SCHEMA_VERSION, kind.currentVersion());
        envelope.put(KIND, kind.tag());
        envelope.set(DATA, data);

        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to encode " + kind.tag() + " record", e);
        }
    }

    public <T> T decode(RecordKind kind, StoredRecord record, Class<T> type) {
        RecordEnvelope envelope = upgrade(read(kind, record));

        ObjectNode data = envelope.getData();
        data.put("id", record.getId());
        if (record.getCreatedAt() != null) {
            data.put("createdAt", record.getCreatedAt().toString());
        }

        try {
            return mapper.treeToValue(data, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(
                String.format("Corrupt %s record %s: %s", kind.tag(), record.getId(), e.getOriginalMessage()), e);
        }
    }

    RecordEnvelope read(RecordKind kind, StoredRecord record) {
        JsonNode root;
        try {
            root = mapper.readTree(record.getPayload());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(
                String.format("Corrupt %s record %s: payload is not JSON", kind.tag(), record.getId()), e);
        }

        if (root == null || !root.isObject()) {
            throw new IllegalStateException(
                String.format("Corrupt %s record %s: payload is not an object", kind.tag(), record.getId()));
        }

        if (!root.has(SCHEMA_VERSION)) {
            return new RecordEnvelope(1, kind, (ObjectNode) root);
        }

        RecordKind tagged = RecordKind.fromTag(root.path(KIND).asText());
        if (tagged != kind) {
            throw new IllegalStateException(String.format(
                "Record %s is tagged %s but was read as %s", record.getId(), tagged.tag(), kind.tag()));
        }

        JsonNode data = root.get(DATA);
        if (data == null || !data.isObject()) {
            throw new IllegalStateException(
                String.format("Corrupt %s record %s: missing data", kind.tag(), record.getId()));
        }
        return new RecordEnvelope(root.get(SCHEMA_VERSION).asInt(), kind, (ObjectNode) data);
    }

    RecordEnvelope upgrade(RecordEnvelope envelope) {
        RecordKind kind = envelope.getKind();
        if (envelope.getSchemaVersion() > kind.currentVersion()) {
            throw new IllegalStateException(String.format(
                "%s record has schema version %d but this service only reads up to %d",
                kind.tag(), envelope.getSchemaVersion(), kind.currentVersion()));
        }

        RecordEnvelope current = envelope;
        while (current.getSchemaVersion() < kind.currentVersion()) {
            int from = current.getSchemaVersion();
            RecordMigration migration = migrations.find(kind, from)
                .orElseThrow(() -> new IllegalStateException(
                    String.format("No migration for %s records from version %d", kind.tag(), from)));
            current = current.withData(from + 1, migration.migrate(current.getData()));
            log.debug("Migrated {} record to schema version {}", kind.tag(), from + 1);
        }
        return current;
    }
}
