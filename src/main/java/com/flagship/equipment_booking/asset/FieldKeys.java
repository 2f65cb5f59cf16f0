package com.flagship.equipment_booking.asset;

import java.util.List;

/**
 * Field-key conventions shared by assets, groups and kit pool filters.
 *
 * A key of the form {@code customField:<id>} addresses a custom field.
 * Every other key addresses a descriptive field by name.
 */
public final class FieldKeys {

    public static final String CUSTOM_FIELD_PREFIX = "customField:";

    public static final String MANUFACTURER = "manufacturer";
    public static final String MODEL = "model";
    public static final String DESCRIPTION = "description";
    public static final String LOCATION = "location";

    /**
     * Descriptive fields a group can hand down to its members.
     */
    public static final List<String> DESCRIPTIVE_FIELDS = List.of(MANUFACTURER, MODEL, DESCRIPTION, LOCATION);

    private FieldKeys() {
        // Utility class
    }

    public static boolean isCustomField(String key) {
        return key != null && key.startsWith(CUSTOM_FIELD_PREFIX);
    }

    public static String customFieldId(String key) {
        return key.substring(CUSTOM_FIELD_PREFIX.length());
    }

    public static String customFieldKey(String fieldId) {
        return CUSTOM_FIELD_PREFIX + fieldId;
    }

    public static boolean isDescriptiveField(String key) {
        return DESCRIPTIVE_FIELDS.contains(key);
    }
}
