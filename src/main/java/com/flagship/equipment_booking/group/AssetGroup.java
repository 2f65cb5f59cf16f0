package com.flagship.equipment_booking.group;

import com.flagship.equipment_booking.asset.AssetGroupRef;
import com.flagship.equipment_booking.asset.FieldKeys;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A set of interchangeable assets that share descriptive fields.
 *
 * memberAssetIds is the single source of truth for membership. memberCount
 * follows it, except for legacy records that carried their own count.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AssetGroup {
    String id;
    String groupNumber;
    String name;
    String assetTypeId;

    String manufacturer;
    String model;
    String description;
    String location;

    @Builder.Default
    List<String> memberAssetIds = List.of();
    int memberCount;
    @Builder.Default
    Map<String, InheritanceRule> inheritanceRules = Map.of();
    @Builder.Default
    Map<String, Object> sharedCustomFields = Map.of();

    Instant createdAt;

    public boolean hasMember(String assetId) {
        return memberAssetIds.contains(assetId);
    }

    public AssetGroup withMembers(List<String> members) {
        return toBuilder()
            .memberAssetIds(List.copyOf(members))
            .memberCount(members.size())
            .build();
    }

    public AssetGroupRef toRef() {
        return AssetGroupRef.builder()
            .id(id)
            .groupNumber(groupNumber)
            .name(name)
            .build();
    }

    /**
     * The group's stored value for a field key, or null when the group does
     * not define it.
     */
    public Object fieldValue(String key) {
        if (FieldKeys.isCustomField(key)) {
            return sharedCustomFields.get(FieldKeys.customFieldId(key));
        }
        return switch (key) {
            case FieldKeys.MANUFACTURER -> manufacturer;
            case FieldKeys.MODEL -> model;
            case FieldKeys.DESCRIPTION -> description;
            case FieldKeys.LOCATION -> location;
            default -> sharedCustomFields.get(key);
        };
    }

    public boolean isInherited(String key) {
        InheritanceRule rule = inheritanceRules.get(key);
        return rule != null && rule.isInherited();
    }
}
