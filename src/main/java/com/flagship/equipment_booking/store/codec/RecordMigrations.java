package com.flagship.equipment_booking.store.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.equipment_booking.asset.FieldKeys;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of schema migrations, keyed by kind and source version.
 *
 * Version 1 is the untagged legacy shape: fields present or absent
 * depending on which client wrote the record. Each migration normalizes
 * exactly one step.
 */
public final class RecordMigrations {

    private final Map<RecordKind, Map<Integer, RecordMigration>> migrations = new EnumMap<>(RecordKind.class);

    private RecordMigrations() {
    }

    public static RecordMigrations standard() {
        RecordMigrations registry = new RecordMigrations();
        registry.register(RecordKind.ASSET, 1, RecordMigrations::assetV1ToV2);
        registry.register(RecordKind.BOOKING, 1, RecordMigrations::bookingV1ToV2);
        registry.register(RecordKind.ASSET_GROUP, 1, RecordMigrations::assetGroupV1ToV2);
        return registry;
    }

    public void register(RecordKind kind, int fromVersion, RecordMigration migration) {
        migrations.computeIfAbsent(kind, k -> new HashMap<>()).put(fromVersion, migration);
    }

    public Optional<RecordMigration> find(RecordKind kind, int fromVersion) {
        return Optional.ofNullable(migrations.getOrDefault(kind, Map.of()).get(fromVersion));
    }

    /**
     * v1 assets embedded the asset type as an object and carried an
     * isParent flag that is now derived from childAssetIds.
     */
    static ObjectNode assetV1ToV2(ObjectNode data) {
        flattenReference(data, "assetType", "assetTypeId");
        data.remove("isParent");
        putIfMissing(data, "status", "available");
        if (!data.hasNonNull("bookable")) {
            data.put("bookable", true);
        }
        return data;
    }

    /**
     * v1 bookings referenced their target through embedded asset/kit
     * snapshots and stamped the creator as requestedBy.
     */
    static ObjectNode bookingV1ToV2(ObjectNode data) {
        if (!data.has("target")) {
            ObjectNode target = data.putObject("target");
            JsonNode kit = data.get("kit");
            JsonNode asset = data.get("asset");
            if (kit != null && kit.hasNonNull("id")) {
                target.put("type", "kit");
                target.put("kitId", kit.get("id").asText());
            } else if (asset != null && asset.hasNonNull("id")) {
                target.put("type", "asset");
                target.put("assetId", asset.get("id").asText());
            }
        }
        data.remove("asset");
        data.remove("kit");

        rename(data, "requestedBy", "bookedById");
        rename(data, "requestedByName", "bookedByName");

        putIfMissing(data, "bookingMode", "date-range");
        putIfMissing(data, "status", "pending");
        if (!data.hasNonNull("quantity")) {
            data.put("quantity", 1);
        }
        return data;
    }

    /**
     * v1 groups kept custom-field inheritance in a separate
     * customFieldRules map. v2 keeps all rules in inheritanceRules under
     * the customField: key convention.
     */
    static ObjectNode assetGroupV1ToV2(ObjectNode data) {
        flattenReference(data, "assetType", "assetTypeId");

        ObjectNode rules = data.has("inheritanceRules") && data.get("inheritanceRules").isObject()
            ? (ObjectNode) data.get("inheritanceRules")
            : data.putObject("inheritanceRules");

        JsonNode customRules = data.remove("customFieldRules");
        if (customRules != null && customRules.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = customRules.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                rules.set(FieldKeys.customFieldKey(entry.getKey()), entry.getValue());
            }
        }

        if (!data.has("memberAssetIds") || !data.get("memberAssetIds").isArray()) {
            data.putArray("memberAssetIds");
        }
        if (!data.hasNonNull("memberCount")) {
            data.put("memberCount", ((ArrayNode) data.get("memberAssetIds")).size());
        }
        return data;
    }

    private static void flattenReference(ObjectNode data, String objectField, String idField) {
        JsonNode reference = data.remove(objectField);
        if (!data.hasNonNull(idField) && reference != null && reference.hasNonNull("id")) {
            data.put(idField, reference.get("id").asText());
        }
    }

    private static void rename(ObjectNode data, String from, String to) {
        JsonNode value = data.remove(from);
        if (value != null && !data.has(to)) {
            data.set(to, value);
        }
    }

    private static void putIfMissing(ObjectNode data, String field, String value) {
        if (!data.hasNonNull(field)) {
            data.put(field, value);
        }
    }
}
