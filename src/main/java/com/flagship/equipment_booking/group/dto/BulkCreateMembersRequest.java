package com.flagship.equipment_booking.group.dto;

import com.flagship.equipment_booking.asset.Asset;
import jakarta.validation.constraints.Min;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class BulkCreateMembersRequest {

    @Min(value = 1, message = "Count must be at least 1")
    int count;

    String assetNumber;
    String name;
    String assetTypeId;
    String manufacturer;
    String model;
    String description;
    String location;
    Boolean bookable;
    Map<String, Object> customFieldValues;

    public Asset toBaseAsset() {
        return Asset.builder()
            .assetNumber(assetNumber)
            .name(name)
            .assetTypeId(assetTypeId)
            .manufacturer(manufacturer)
            .model(model)
            .description(description)
            .location(location)
            .bookable(bookable == null || bookable)
            .customFieldValues(customFieldValues == null ? Map.of() : customFieldValues)
            .build();
    }
}
