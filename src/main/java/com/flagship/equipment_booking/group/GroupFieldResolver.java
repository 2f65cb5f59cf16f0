package com.flagship.equipment_booking.group;

import com.flagship.equipment_booking.asset.Asset;
import com.flagship.equipment_booking.asset.FieldSource;
import com.flagship.equipment_booking.inventory.InventoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decides where the effective value of a grouped asset's field comes from.
 *
 * Decision order:
 * 1. No group: the asset's own value, source local
 * 2. fieldSources[key] == override: the asset's own value, source override
 * 3. Group rule for key is inherited: the group's value, source group
 * 4. Otherwise: the asset's own value, source local
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GroupFieldResolver {

    private final InventoryStore inventoryStore;

    public FieldResolution resolve(String assetId, String fieldKey) {
        Asset asset = inventoryStore.getAsset(assetId);
        AssetGroup group = null;
        if (asset.getAssetGroup() != null) {
            group = inventoryStore.getAssetGroup(asset.getAssetGroup().getId()).orElse(null);
            if (group == null) {
                log.warn("Asset {} references missing group {}", assetId, asset.getAssetGroup().getId());
            }
        }
        return resolve(asset, group, fieldKey);
    }

    public static FieldResolution resolve(Asset asset, AssetGroup group, String fieldKey) {
        if (group == null) {
            return FieldResolution.of(asset.fieldValue(fieldKey), FieldSource.LOCAL);
        }
        if (asset.getFieldSources().get(fieldKey) == FieldSource.OVERRIDE) {
            return FieldResolution.of(asset.fieldValue(fieldKey), FieldSource.OVERRIDE);
        }
        if (group.isInherited(fieldKey)) {
            return FieldResolution.of(group.fieldValue(fieldKey), FieldSource.GROUP);
        }
        return FieldResolution.of(asset.fieldValue(fieldKey), FieldSource.LOCAL);
    }

    /**
     * Field sources a member of {@code group} should carry.
     *
     * Overrides in {@code existing} survive, inherited rules source their
     * field from the group, and a stale group source on a rule that is no
     * longer inherited is dropped.
     */
    public static Map<String, FieldSource> computeFieldSources(AssetGroup group, Map<String, FieldSource> existing) {
        Map<String, FieldSource> sources = new LinkedHashMap<>();
        if (existing != null) {
            existing.forEach((key, source) -> {
                if (source == FieldSource.OVERRIDE) {
                    sources.put(key, source);
                }
            });
        }

        group.getInheritanceRules().forEach((key, rule) -> {
            if (rule == null) {
                return;
            }
            if (rule.isInherited()) {
                sources.putIfAbsent(key, FieldSource.GROUP);
            } else if (sources.get(key) == FieldSource.GROUP) {
                sources.remove(key);
            }
        });
        return sources;
    }
}
