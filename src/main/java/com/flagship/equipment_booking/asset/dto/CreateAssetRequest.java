package com.flagship.equipment_booking.asset.dto;

import com.flagship.equipment_booking.asset.Asset;
import com.flagship.equipment_booking.asset.AssetStatus;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class CreateAssetRequest {

    @NotBlank(message = "Asset number is required")
    String assetNumber;

    String name;
    String assetTypeId;
    String manufacturer;
    String model;
    String description;
    String location;
    AssetStatus status;
    Boolean bookable;
    String parentAssetId;
    Map<String, Object> customFieldValues;

    public Asset toAsset() {
        return Asset.builder()
            .assetNumber(assetNumber)
            .name(name)
            .assetTypeId(assetTypeId)
            .manufacturer(manufacturer)
            .model(model)
            .description(description)
            .location(location)
            .status(status == null ? AssetStatus.AVAILABLE : status)
            .bookable(bookable == null || bookable)
            .parentAssetId(parentAssetId)
            .customFieldValues(customFieldValues == null ? Map.of() : customFieldValues)
            .build();
    }
}
