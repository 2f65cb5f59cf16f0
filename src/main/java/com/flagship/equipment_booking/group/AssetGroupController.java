package com.flagship.equipment_booking.group;

import com.flagship.equipment_booking.asset.Asset;
import com.flagship.equipment_booking.booking.BookingService;
import com.flagship.equipment_booking.booking.GroupBookingResult;
import com.flagship.equipment_booking.booking.dto.GroupBookingRequest;
import com.flagship.equipment_booking.group.dto.BulkCreateMembersRequest;
import com.flagship.equipment_booking.group.dto.BulkUpdateMembersRequest;
import com.flagship.equipment_booking.group.dto.CreateAssetGroupRequest;
import com.flagship.equipment_booking.group.dto.MembershipRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/asset-groups")
@RequiredArgsConstructor
public class AssetGroupController {

    private final AssetGroupService assetGroupService;
    private final BookingService bookingService;

    @PostMapping
    public ResponseEntity<AssetGroup> createAssetGroup(@Valid @RequestBody CreateAssetGroupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(assetGroupService.createAssetGroup(request.toAssetGroup()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AssetGroup> getAssetGroup(@PathVariable("id") String id) {
        return ResponseEntity.ok(assetGroupService.getAssetGroup(id));
    }

    @GetMapping
    public ResponseEntity<List<AssetGroup>> listAssetGroups() {
        return ResponseEntity.ok(assetGroupService.listAssetGroups());
    }

    @PatchMapping("/{id}")
    public ResponseEntity<AssetGroup> updateAssetGroup(
            @PathVariable("id") String id,
            @RequestBody AssetGroupUpdate update) {
        return ResponseEntity.ok(assetGroupService.updateAssetGroup(id, update));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteAssetGroup(
            @PathVariable("id") String id,
            @RequestParam(value = "reassignAssets", defaultValue = "false") boolean reassignAssets) {
        assetGroupService.deleteAssetGroup(id, reassignAssets);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/dissolve")
    public ResponseEntity<AssetGroup> dissolveAssetGroup(@PathVariable("id") String id) {
        return ResponseEntity.ok(assetGroupService.dissolveAssetGroup(id));
    }

    @PostMapping("/{id}/members/bulk-create")
    public ResponseEntity<List<Asset>> bulkCreateMembers(
            @PathVariable("id") String id,
            @Valid @RequestBody BulkCreateMembersRequest request) {
        List<Asset> created = assetGroupService.bulkCreateAssetsForGroup(id, request.getCount(), request.toBaseAsset());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @PostMapping("/{id}/members")
    public ResponseEntity<Asset> addMember(
            @PathVariable("id") String id,
            @Valid @RequestBody MembershipRequest request) {
        return ResponseEntity.ok(assetGroupService.addAssetToGroup(request.getAssetId(), id));
    }

    @DeleteMapping("/{id}/members/{assetId}")
    public ResponseEntity<Asset> removeMember(
            @PathVariable("id") String id,
            @PathVariable("assetId") String assetId) {
        return ResponseEntity.ok(assetGroupService.removeAssetFromGroup(id, assetId));
    }

    @PostMapping("/{id}/bulk-update")
    public ResponseEntity<List<Asset>> bulkUpdateMembers(
            @PathVariable("id") String id,
            @RequestBody BulkUpdateMembersRequest request) {
        return ResponseEntity.ok(assetGroupService.bulkUpdateGroupMembers(id, request.getPatch(), request.isClearOverrides()));
    }

    @PostMapping("/{id}/bookings")
    public ResponseEntity<GroupBookingResult> bookMembers(
            @PathVariable("id") String id,
            @RequestHeader(value = "Idempotency-Key", required = false) String idempotencyKey,
            @Valid @RequestBody GroupBookingRequest request) {
        String requestKey = idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey;
        GroupBookingResult result = bookingService.createGroupBooking(
            id, request.getAssetIds(), request.getBooking().toCommand(requestKey), request.isStopOnError());
        HttpStatus status = result.getSuccesses().isEmpty() ? HttpStatus.CONFLICT : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(result);
    }
}
