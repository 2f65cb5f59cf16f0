package com.flagship.equipment_booking.group;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Edit of a group's own fields. Null members are left alone; rules are
 * merged into the existing ones, shared custom fields replace them.
 * Membership cannot be changed through an update.
 */
@Value
@Builder
@Jacksonized
public class AssetGroupUpdate {
    String name;
    String manufacturer;
    String model;
    String description;
    String location;
    Map<String, InheritanceRule> inheritanceRules;
    Map<String, Object> sharedCustomFields;

    AssetGroup applyTo(AssetGroup group) {
        AssetGroup.AssetGroupBuilder builder = group.toBuilder();
        if (name != null) {
            builder.name(name);
        }
        if (manufacturer != null) {
            builder.manufacturer(manufacturer);
        }
        if (model != null) {
            builder.model(model);
        }
        if (description != null) {
            builder.description(description);
        }
        if (location != null) {
            builder.location(location);
        }
        if (inheritanceRules != null) {
            Map<String, InheritanceRule> merged = new LinkedHashMap<>(group.getInheritanceRules());
            merged.putAll(inheritanceRules);
            builder.inheritanceRules(merged);
        }
        if (sharedCustomFields != null) {
            builder.sharedCustomFields(sharedCustomFields);
        }
        return builder.build();
    }
}
