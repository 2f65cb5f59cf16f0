package com.flagship.equipment_booking.asset;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A bookable piece of equipment.
 *
 * An asset with child assets is a multi-unit parent: bookings against it
 * are served by allocating concrete children. Status broken, sold,
 * destroyed and deleted always block new bookings.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Asset {
    String id;
    String assetNumber;
    String name;
    String assetTypeId;

    String manufacturer;
    String model;
    String description;
    String location;

    @Builder.Default
    AssetStatus status = AssetStatus.AVAILABLE;
    @Builder.Default
    boolean bookable = true;

    String parentAssetId;
    @Builder.Default
    List<String> childAssetIds = List.of();

    AssetGroupRef assetGroup;
    @Builder.Default
    Map<String, FieldSource> fieldSources = Map.of();
    @Builder.Default
    Map<String, Object> customFieldValues = Map.of();

    InUseBy inUseBy;
    String currentBookingId;
    Instant createdAt;

    @JsonIgnore
    public boolean isMultiUnit() {
        return childAssetIds != null && !childAssetIds.isEmpty();
    }

    /**
     * The asset's own stored value for a field key.
     */
    public Object fieldValue(String key) {
        if (FieldKeys.isCustomField(key)) {
            return customFieldValues.get(FieldKeys.customFieldId(key));
        }
        return switch (key) {
            case "name" -> name;
            case "assetNumber" -> assetNumber;
            case "assetTypeId" -> assetTypeId;
            case "status" -> status == null ? null : status.value();
            case FieldKeys.MANUFACTURER -> manufacturer;
            case FieldKeys.MODEL -> model;
            case FieldKeys.DESCRIPTION -> description;
            case FieldKeys.LOCATION -> location;
            default -> customFieldValues.get(key);
        };
    }

    /**
     * Copy of this asset with one field's stored value replaced. A null
     * value clears the field.
     */
    public Asset withFieldValue(String key, Object value) {
        String text = value == null ? null : String.valueOf(value);
        if (FieldKeys.isCustomField(key)) {
            return withCustomFieldValue(FieldKeys.customFieldId(key), value);
        }
        return switch (key) {
            case FieldKeys.MANUFACTURER -> toBuilder().manufacturer(text).build();
            case FieldKeys.MODEL -> toBuilder().model(text).build();
            case FieldKeys.DESCRIPTION -> toBuilder().description(text).build();
            case FieldKeys.LOCATION -> toBuilder().location(text).build();
            case "name" -> toBuilder().name(text).build();
            default -> withCustomFieldValue(key, value);
        };
    }

    /**
     * Equality match used by kit pool filters. Plain keys are looked up in
     * the custom fields first, then in the descriptive fields.
     */
    public boolean matchesFilter(String key, Object expected) {
        Object actual;
        if (FieldKeys.isCustomField(key)) {
            actual = customFieldValues.get(FieldKeys.customFieldId(key));
        } else if (customFieldValues.containsKey(key)) {
            actual = customFieldValues.get(key);
        } else {
            actual = fieldValue(key);
        }
        return valuesEqual(actual, expected);
    }

    private Asset withCustomFieldValue(String fieldId, Object value) {
        Map<String, Object> values = new LinkedHashMap<>(customFieldValues);
        if (value == null) {
            values.remove(fieldId);
        } else {
            values.put(fieldId, value);
        }
        return toBuilder().customFieldValues(values).build();
    }

    // JSON numbers may come back as Integer or Double depending on how they were written
    static boolean valuesEqual(Object actual, Object expected) {
        if (actual instanceof Number && expected instanceof Number) {
            return new BigDecimal(actual.toString()).compareTo(new BigDecimal(expected.toString())) == 0;
        }
        return Objects.equals(actual, expected);
    }
}
