package com.flagship.equipment_booking.group;

import com.flagship.equipment_booking.asset.Asset;
import com.flagship.equipment_booking.asset.AssetPatch;
import com.flagship.equipment_booking.asset.AssetService;
import com.flagship.equipment_booking.asset.FieldKeys;
import com.flagship.equipment_booking.asset.FieldSource;
import com.flagship.equipment_booking.exception.ResourceNotFoundException;
import com.flagship.equipment_booking.history.ChangeEntry;
import com.flagship.equipment_booking.history.ChangeHistoryRecorder;
import com.flagship.equipment_booking.history.FieldChange;
import com.flagship.equipment_booking.inventory.InventoryStore;
import com.flagship.equipment_booking.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Asset group operations.
 *
 * Membership is two-sided: the group's memberAssetIds and each member's
 * assetGroup back-reference. The store cannot write both atomically, so
 * writes are ordered to keep "the back-reference points to a group that
 * lists the asset" true at every step:
 * - joining writes the group's member set first, then the back-reference
 * - leaving clears the back-reference first, then the member set
 * Deleting and dissolving a group detach every member before the group
 * record changes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssetGroupService {

    static final Map<String, InheritanceRule> DEFAULT_INHERITANCE_RULES = Map.of(
        FieldKeys.MANUFACTURER, InheritanceRule.of(true, true),
        FieldKeys.MODEL, InheritanceRule.of(true, true),
        FieldKeys.DESCRIPTION, InheritanceRule.of(true, true)
    );

    private final InventoryStore inventoryStore;
    private final AssetService assetService;
    private final GroupFieldResolver fieldResolver;
    private final ChangeHistoryRecorder historyRecorder;
    private final Clock clock;

    // ==================== Groups ====================

    public AssetGroup createAssetGroup(AssetGroup draft) {
        if (draft.getName() == null || draft.getName().isBlank()) {
            throw new IllegalArgumentException("Group name is required");
        }

        Map<String, InheritanceRule> rules = new LinkedHashMap<>(DEFAULT_INHERITANCE_RULES);
        rules.putAll(draft.getInheritanceRules());

        String groupNumber = draft.getGroupNumber() == null || draft.getGroupNumber().isBlank()
            ? nextGroupNumber()
            : draft.getGroupNumber();

        AssetGroup created = inventoryStore.createAssetGroup(draft.toBuilder()
            .id(null)
            .createdAt(null)
            .groupNumber(groupNumber)
            .inheritanceRules(rules)
            .memberAssetIds(List.of())
            .memberCount(0)
            .build());

        historyRecorder.record(ChangeEntry.of("asset-group", created.getId(), "created",
                inventoryStore.getCurrentActor(), clock.instant())
            .toBuilder().entityName(created.getName()).build());

        log.info("Asset group created: groupId={}, groupNumber={}", created.getId(), created.getGroupNumber());
        return created;
    }

    public AssetGroup getAssetGroup(String id) {
        return inventoryStore.getAssetGroup(id)
            .orElseThrow(() -> new ResourceNotFoundException("Asset group", id));
    }

    public List<AssetGroup> listAssetGroups() {
        return inventoryStore.getAssetGroups();
    }

    /**
     * Edits the group's own fields. Members pick up the new values on the
     * next {@link #bulkUpdateGroupMembers} and through field resolution.
     */
    public AssetGroup updateAssetGroup(String groupId, AssetGroupUpdate update) {
        getAssetGroup(groupId);
        AssetGroup updated = inventoryStore.updateAssetGroup(groupId, update::applyTo);

        historyRecorder.record(ChangeEntry.of("asset-group", groupId, "updated",
            inventoryStore.getCurrentActor(), clock.instant()));
        return updated;
    }

    /**
     * Deletes a group. A group that does not exist is left alone.
     *
     * With {@code reassignAssets} every member is detached first: its
     * back-reference and field sources are cleared, the asset itself stays.
     * A failed detach aborts before the group record is removed.
     *
     * @throws IllegalStateException if members remain and {@code reassignAssets} is false
     */
    public void deleteAssetGroup(String groupId, boolean reassignAssets) {
        Optional<AssetGroup> existing = inventoryStore.getAssetGroup(groupId);
        if (existing.isEmpty()) {
            log.debug("Asset group {} not found, nothing to delete", groupId);
            return;
        }

        AssetGroup group = existing.get();
        if (!group.getMemberAssetIds().isEmpty()) {
            if (!reassignAssets) {
                throw new IllegalStateException(String.format(
                    "Cannot delete asset group %s: %d member asset(s) still assigned",
                    group.getGroupNumber(), group.getMemberAssetIds().size()));
            }
            group.getMemberAssetIds().forEach(memberId -> detach(memberId, groupId));
        }

        inventoryStore.deleteAssetGroup(groupId);

        historyRecorder.record(ChangeEntry.of("asset-group", groupId, "deleted",
                inventoryStore.getCurrentActor(), clock.instant())
            .toBuilder()
            .entityName(group.getName())
            .note(group.getGroupNumber())
            .build());
        log.info("Asset group deleted: groupId={}, detachedMembers={}", groupId, group.getMemberAssetIds().size());
    }

    /**
     * Detaches every member and leaves the group empty. The group record
     * itself is kept.
     */
    public AssetGroup dissolveAssetGroup(String groupId) {
        AssetGroup group = getAssetGroup(groupId);
        if (group.getMemberAssetIds().isEmpty()) {
            return group;
        }

        group.getMemberAssetIds().forEach(memberId -> detach(memberId, groupId));
        AssetGroup dissolved = inventoryStore.updateAssetGroup(groupId, current -> current.withMembers(List.of()));

        historyRecorder.record(ChangeEntry.of("asset-group", groupId, "dissolved",
            inventoryStore.getCurrentActor(), clock.instant()));
        log.info("Asset group dissolved: groupId={}, formerMembers={}", groupId, group.getMemberAssetIds().size());
        return dissolved;
    }

    /**
     * Creates {@code count} new assets as members of the group.
     *
     * Numbers and names continue from the current member count
     * ({@code GRP-0001-003}, {@code "LED panels #3"}). A single asset keeps
     * an explicit number and name from {@code base}. Inherited fields the
     * base leaves empty take the group's values and shared custom fields are
     * copied under the base's own values.
     *
     * @throws IllegalArgumentException if count is below 1 or the base asset type differs from the group's
     */
    public List<Asset> bulkCreateAssetsForGroup(String groupId, int count, Asset base) {
        if (count < 1) {
            throw new IllegalArgumentException("Count must be at least 1");
        }

        AssetGroup group = getAssetGroup(groupId);
        Asset template = base == null ? Asset.builder().build() : base;
        if (template.getAssetTypeId() != null && group.getAssetTypeId() != null
                && !group.getAssetTypeId().equals(template.getAssetTypeId())) {
            throw new IllegalArgumentException("Base asset type does not match the group's asset type");
        }

        boolean single = count == 1;
        String baseName = isBlank(template.getName()) ? group.getName() : template.getName().trim();
        String baseNumber = isBlank(template.getAssetNumber()) ? group.getGroupNumber() : template.getAssetNumber().trim();

        Map<String, Object> customFieldValues = new LinkedHashMap<>(group.getSharedCustomFields());
        customFieldValues.putAll(template.getCustomFieldValues());

        int firstSequence = group.getMemberAssetIds().size() + 1;
        List<Asset> created = new ArrayList<>();
        for (int index = 0; index < count; index++) {
            int sequence = firstSequence + index;
            Asset draft = template.toBuilder()
                .assetNumber(single && !isBlank(template.getAssetNumber())
                    ? baseNumber
                    : String.format("%s-%03d", baseNumber, sequence))
                .name(single ? baseName : baseName + " #" + sequence)
                .assetTypeId(template.getAssetTypeId() == null ? group.getAssetTypeId() : template.getAssetTypeId())
                .manufacturer(inheritedOr(group, FieldKeys.MANUFACTURER, template.getManufacturer()))
                .model(inheritedOr(group, FieldKeys.MODEL, template.getModel()))
                .description(inheritedOr(group, FieldKeys.DESCRIPTION, template.getDescription()))
                .parentAssetId(null)
                .customFieldValues(customFieldValues)
                .build();

            Asset asset = assetService.createAsset(draft);
            created.add(join(asset, group));
            recordMembership(asset.getId(), "joined-group", null, group);
        }

        log.info("Created {} member(s) for group {}", created.size(), groupId);
        return created;
    }

    /**
     * Creates a group from an existing asset and makes the asset its first
     * member. Group number and name default to the asset's; inherited fields
     * are copied from the asset.
     *
     * @throws IllegalStateException if the asset already belongs to a group
     */
    public GroupConversion convertAssetToGroup(String assetId, AssetGroup template) {
        Asset asset = inventoryStore.getAsset(assetId);
        if (asset.getAssetGroup() != null) {
            throw new IllegalStateException(String.format(
                "Asset %s already belongs to group %s", asset.getAssetNumber(), asset.getAssetGroup().getName()));
        }

        AssetGroup options = template == null ? AssetGroup.builder().build() : template;
        Map<String, InheritanceRule> rules = new LinkedHashMap<>(DEFAULT_INHERITANCE_RULES);
        rules.putAll(options.getInheritanceRules());
        AssetGroup withRules = AssetGroup.builder().inheritanceRules(rules).build();

        String name = !isBlank(options.getName()) ? options.getName()
            : !isBlank(asset.getName()) ? asset.getName() : asset.getAssetNumber();

        AssetGroup group = createAssetGroup(AssetGroup.builder()
            .groupNumber(isBlank(options.getGroupNumber()) ? asset.getAssetNumber() : options.getGroupNumber().trim())
            .name(name)
            .assetTypeId(asset.getAssetTypeId())
            .manufacturer(withRules.isInherited(FieldKeys.MANUFACTURER) ? asset.getManufacturer() : null)
            .model(withRules.isInherited(FieldKeys.MODEL) ? asset.getModel() : null)
            .description(withRules.isInherited(FieldKeys.DESCRIPTION) ? asset.getDescription() : null)
            .inheritanceRules(rules)
            .sharedCustomFields(options.getSharedCustomFields())
            .build());

        Asset member = join(asset, group);
        recordMembership(assetId, "joined-group", null, group);
        log.info("Asset {} converted to group {}", assetId, group.getId());
        return GroupConversion.of(getAssetGroup(group.getId()), member);
    }

    // ==================== Membership ====================

    /**
     * @throws IllegalStateException if the asset already belongs to another group
     * @throws IllegalArgumentException if the asset type does not match the group's
     */
    public Asset addAssetToGroup(String assetId, String groupId) {
        Asset asset = inventoryStore.getAsset(assetId);
        AssetGroup group = getAssetGroup(groupId);

        if (asset.getAssetGroup() != null) {
            if (groupId.equals(asset.getAssetGroup().getId()) && group.hasMember(assetId)) {
                return asset;
            }
            if (!groupId.equals(asset.getAssetGroup().getId())) {
                throw new IllegalStateException(String.format(
                    "Asset %s already belongs to group %s", asset.getAssetNumber(), asset.getAssetGroup().getName()));
            }
        }
        ensureMatchesAssetType(asset, group);

        Asset joined = join(asset, group);
        recordMembership(assetId, "joined-group", null, group);
        log.info("Asset {} added to group {}", assetId, groupId);
        return joined;
    }

    public Asset removeAssetFromGroup(String assetId) {
        Asset asset = inventoryStore.getAsset(assetId);
        if (asset.getAssetGroup() == null) {
            return asset;
        }

        String groupId = asset.getAssetGroup().getId();
        Asset detached = leave(asset);
        recordMembership(assetId, "left-group", groupId, null);
        log.info("Asset {} removed from group {}", assetId, groupId);
        return detached;
    }

    /**
     * Removes the asset from the given group.
     *
     * @throws IllegalStateException if the asset is not a member of that group
     */
    public Asset removeAssetFromGroup(String groupId, String assetId) {
        Asset asset = inventoryStore.getAsset(assetId);
        AssetGroup group = getAssetGroup(groupId);
        boolean referencesGroup = asset.getAssetGroup() != null && groupId.equals(asset.getAssetGroup().getId());
        if (!referencesGroup && !group.hasMember(assetId)) {
            throw new IllegalStateException("Asset is not a member of this group");
        }
        if (!referencesGroup) {
            // Stale member entry without a back-reference
            inventoryStore.updateAssetGroup(groupId, current -> current.withMembers(without(current, assetId)));
            return asset;
        }
        return removeAssetFromGroup(assetId);
    }

    /**
     * Moves an asset into {@code targetGroupId}: joins the target first, then
     * leaves the previous group's member set.
     */
    public Asset reassignAssetToGroup(String assetId, String targetGroupId) {
        Asset asset = inventoryStore.getAsset(assetId);
        String previousGroupId = asset.getAssetGroup() == null ? null : asset.getAssetGroup().getId();

        if (targetGroupId.equals(previousGroupId)) {
            return asset;
        }

        AssetGroup target = getAssetGroup(targetGroupId);
        ensureMatchesAssetType(asset, target);

        Asset moved = join(asset, target);

        if (previousGroupId != null) {
            Optional<AssetGroup> previous = inventoryStore.getAssetGroup(previousGroupId);
            if (previous.isPresent()) {
                inventoryStore.updateAssetGroup(previousGroupId,
                    current -> current.withMembers(without(current, assetId)));
            } else {
                log.warn("Previous group {} of asset {} no longer exists", previousGroupId, assetId);
            }
        }

        recordMembership(assetId, "reassigned-group", previousGroupId, target);
        log.info("Asset {} reassigned from group {} to {}", assetId, previousGroupId, targetGroupId);
        return moved;
    }

    // ==================== Field values ====================

    public FieldResolution resolveAssetFieldValue(String assetId, String fieldKey) {
        return fieldResolver.resolve(assetId, fieldKey);
    }

    /**
     * Applies {@code patch} to every member and fans group values out.
     *
     * Per member: field sources are recomputed from the group's rules (keeping
     * overrides unless {@code clearOverrides}), sources named in the patch win,
     * and every field sourced from the group gets the group's value, or is
     * cleared when the group does not define it. Overridden fields are left
     * alone. Group membership itself is never changed by this call.
     */
    public List<Asset> bulkUpdateGroupMembers(String groupId, AssetPatch patch, boolean clearOverrides) {
        AssetGroup group = getAssetGroup(groupId);
        AssetPatch base = patch == null ? AssetPatch.builder().build() : patch;

        List<Asset> updated = new ArrayList<>();
        for (String memberId : group.getMemberAssetIds()) {
            Optional<Asset> member = inventoryStore.findAsset(memberId);
            if (member.isEmpty()) {
                log.warn("Group {} lists missing member {}", groupId, memberId);
                continue;
            }

            Asset asset = member.get();
            Map<String, FieldSource> sources = GroupFieldResolver.computeFieldSources(
                group, clearOverrides ? Map.of() : asset.getFieldSources());
            if (base.getFieldSources() != null) {
                sources.putAll(base.getFieldSources());
            }

            Map<String, Object> values = new LinkedHashMap<>();
            if (base.getFieldValues() != null) {
                values.putAll(base.getFieldValues());
            }
            sources.forEach((key, source) -> {
                if (source == FieldSource.GROUP) {
                    values.put(key, group.fieldValue(key));
                }
            });

            AssetPatch memberPatch = base.toBuilder()
                .assetGroup(null)
                .clearAssetGroup(false)
                .fieldSources(sources)
                .fieldValues(values)
                .build();

            try (MDC.MDCCloseable ignored = CorrelationContext.assetScope(memberId)) {
                updated.add(inventoryStore.updateAsset(memberId, memberPatch));
            }

            historyRecorder.record(ChangeEntry.of("asset", memberId, "group-bulk-update",
                    inventoryStore.getCurrentActor(), clock.instant())
                .toBuilder()
                .note(clearOverrides ? "Overrides cleared" : null)
                .build());
        }

        log.info("Bulk-updated {} member(s) of group {} (clearOverrides={})", updated.size(), groupId, clearOverrides);
        return updated;
    }

    // ==================== Helpers ====================

    private Asset join(Asset asset, AssetGroup group) {
        inventoryStore.updateAssetGroup(group.getId(), current -> {
            List<String> members = new ArrayList<>(current.getMemberAssetIds());
            if (!members.contains(asset.getId())) {
                members.add(asset.getId());
            }
            return current.withMembers(members);
        });

        Map<String, FieldSource> sources = GroupFieldResolver.computeFieldSources(group, asset.getFieldSources());
        return inventoryStore.updateAsset(asset.getId(), AssetPatch.builder()
            .assetGroup(group.toRef())
            .fieldSources(sources)
            .build());
    }

    private Asset leave(Asset asset) {
        String groupId = asset.getAssetGroup().getId();
        Asset detached = inventoryStore.updateAsset(asset.getId(), AssetPatch.builder()
            .clearAssetGroup(true)
            .fieldSources(Map.of())
            .build());

        if (inventoryStore.getAssetGroup(groupId).isPresent()) {
            inventoryStore.updateAssetGroup(groupId, current -> current.withMembers(without(current, asset.getId())));
        }
        return detached;
    }

    /**
     * Clears a member's back-reference when it still points at {@code groupId}.
     */
    private void detach(String assetId, String groupId) {
        Optional<Asset> member = inventoryStore.findAsset(assetId);
        if (member.isEmpty()) {
            log.warn("Group {} lists missing member {}", groupId, assetId);
            return;
        }
        if (member.get().getAssetGroup() == null || !groupId.equals(member.get().getAssetGroup().getId())) {
            return;
        }

        inventoryStore.updateAsset(assetId, AssetPatch.builder()
            .clearAssetGroup(true)
            .fieldSources(Map.of())
            .build());
        recordMembership(assetId, "left-group", groupId, null);
    }

    private static String inheritedOr(AssetGroup group, String key, String own) {
        if (own != null || !group.isInherited(key)) {
            return own;
        }
        Object value = group.fieldValue(key);
        return value == null ? null : value.toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static List<String> without(AssetGroup group, String assetId) {
        return group.getMemberAssetIds().stream()
            .filter(id -> !id.equals(assetId))
            .toList();
    }

    private void ensureMatchesAssetType(Asset asset, AssetGroup group) {
        if (group.getAssetTypeId() != null && !group.getAssetTypeId().equals(asset.getAssetTypeId())) {
            throw new IllegalArgumentException(String.format(
                "Asset %s has asset type %s but group %s requires %s",
                asset.getAssetNumber(), asset.getAssetTypeId(), group.getName(), group.getAssetTypeId()));
        }
    }

    private String nextGroupNumber() {
        return String.format("GRP-%04d", inventoryStore.getAssetGroups().size() + 1);
    }

    private void recordMembership(String assetId, String action, String fromGroupId, AssetGroup toGroup) {
        historyRecorder.record(ChangeEntry.of("asset", assetId, action, inventoryStore.getCurrentActor(), clock.instant())
            .toBuilder()
            .changes(List.of(FieldChange.of("assetGroup", fromGroupId, toGroup == null ? null : toGroup.getId())))
            .build());
    }
}
