package com.flagship.equipment_booking.kit.dto;

import com.flagship.equipment_booking.kit.BoundAsset;
import com.flagship.equipment_booking.kit.Kit;
import com.flagship.equipment_booking.kit.KitType;
import com.flagship.equipment_booking.kit.PoolRequirement;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class CreateKitRequest {

    @NotBlank(message = "Kit name is required")
    String name;

    String description;

    String location;

    @NotNull(message = "Kit type is required")
    KitType type;

    List<BoundAsset> boundAssets;

    List<PoolRequirement> poolRequirements;

    public Kit toKit() {
        return Kit.builder()
            .name(name)
            .description(description)
            .location(location)
            .type(type)
            .boundAssets(boundAssets == null ? List.of() : boundAssets)
            .poolRequirements(poolRequirements == null ? List.of() : poolRequirements)
            .build();
    }
}
