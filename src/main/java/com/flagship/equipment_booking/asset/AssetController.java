package com.flagship.equipment_booking.asset;

import com.flagship.equipment_booking.asset.dto.CreateAssetRequest;
import com.flagship.equipment_booking.asset.dto.GroupAssignmentRequest;
import com.flagship.equipment_booking.availability.AvailabilityChecker;
import com.flagship.equipment_booking.group.AssetGroupService;
import com.flagship.equipment_booking.group.FieldResolution;
import com.flagship.equipment_booking.group.GroupConversion;
import com.flagship.equipment_booking.group.dto.ConvertToGroupRequest;
import com.flagship.equipment_booking.inventory.AssetFilter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/assets")
@RequiredArgsConstructor
public class AssetController {

    private final AssetService assetService;
    private final AssetGroupService assetGroupService;
    private final AvailabilityChecker availabilityChecker;

    @PostMapping
    public ResponseEntity<Asset> createAsset(@Valid @RequestBody CreateAssetRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(assetService.createAsset(request.toAsset()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<Asset> getAsset(@PathVariable("id") String id) {
        return ResponseEntity.ok(assetService.getAsset(id));
    }

    @GetMapping
    public ResponseEntity<List<Asset>> listAssets(
            @RequestParam(value = "assetTypeId", required = false) String assetTypeId,
            @RequestParam(value = "parentAssetId", required = false) String parentAssetId,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "groupId", required = false) String groupId) {
        AssetFilter filter = AssetFilter.builder()
            .assetTypeId(assetTypeId)
            .parentAssetId(parentAssetId)
            .status(status == null ? null : AssetStatus.fromValue(status))
            .groupId(groupId)
            .build();
        return ResponseEntity.ok(assetService.listAssets(filter));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Asset> deleteAsset(@PathVariable("id") String id) {
        return ResponseEntity.ok(assetService.deleteAsset(id));
    }

    @GetMapping("/{id}/availability")
    public ResponseEntity<Map<String, Object>> isAvailable(
            @PathVariable("id") String id,
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant end) {
        assetService.getAsset(id);
        boolean available = availabilityChecker.isAvailable(id, start, end);
        return ResponseEntity.ok(Map.of("assetId", id, "available", available));
    }

    @GetMapping("/{id}/fields/{fieldKey}")
    public ResponseEntity<FieldResolution> resolveField(
            @PathVariable("id") String id,
            @PathVariable("fieldKey") String fieldKey) {
        return ResponseEntity.ok(assetGroupService.resolveAssetFieldValue(id, fieldKey));
    }

    @PutMapping("/{id}/group")
    public ResponseEntity<Asset> assignGroup(
            @PathVariable("id") String id,
            @RequestBody GroupAssignmentRequest request) {
        if (request.getGroupId() == null) {
            return ResponseEntity.ok(assetGroupService.removeAssetFromGroup(id));
        }
        return ResponseEntity.ok(assetGroupService.reassignAssetToGroup(id, request.getGroupId()));
    }

    @PostMapping("/{id}/convert-to-group")
    public ResponseEntity<GroupConversion> convertToGroup(
            @PathVariable("id") String id,
            @RequestBody(required = false) ConvertToGroupRequest request) {
        GroupConversion conversion = assetGroupService.convertAssetToGroup(id,
            request == null ? null : request.toTemplate());
        return ResponseEntity.status(HttpStatus.CREATED).body(conversion);
    }
}
