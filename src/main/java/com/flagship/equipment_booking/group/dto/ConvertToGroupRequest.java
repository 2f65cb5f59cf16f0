package com.flagship.equipment_booking.group.dto;

import com.flagship.equipment_booking.group.AssetGroup;
import com.flagship.equipment_booking.group.InheritanceRule;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Optional overrides for a group created from an asset. Missing values are
 * taken from the asset.
 */
@Value
@Builder
@Jacksonized
public class ConvertToGroupRequest {
    String groupNumber;
    String groupName;
    Map<String, InheritanceRule> inheritanceRules;
    Map<String, Object> sharedCustomFields;

    public AssetGroup toTemplate() {
        return AssetGroup.builder()
            .groupNumber(groupNumber)
            .name(groupName)
            .inheritanceRules(inheritanceRules == null ? Map.of() : inheritanceRules)
            .sharedCustomFields(sharedCustomFields == null ? Map.of() : sharedCustomFields)
            .build();
    }
}
