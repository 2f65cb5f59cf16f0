package com.flagship.equipment_booking.group.dto;

import com.flagship.equipment_booking.group.AssetGroup;
import com.flagship.equipment_booking.group.InheritanceRule;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class CreateAssetGroupRequest {

    String groupNumber;

    @NotBlank(message = "Group name is required")
    String name;

    String assetTypeId;
    String manufacturer;
    String model;
    String description;
    String location;
    Map<String, InheritanceRule> inheritanceRules;
    Map<String, Object> sharedCustomFields;

    public AssetGroup toAssetGroup() {
        return AssetGroup.builder()
            .groupNumber(groupNumber)
            .name(name)
            .assetTypeId(assetTypeId)
            .manufacturer(manufacturer)
            .model(model)
            .description(description)
            .location(location)
            .inheritanceRules(inheritanceRules == null ? Map.of() : inheritanceRules)
            .sharedCustomFields(sharedCustomFields == null ? Map.of() : sharedCustomFields)
            .build();
    }
}
