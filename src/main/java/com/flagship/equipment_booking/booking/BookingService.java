package com.flagship.equipment_booking.booking;

import com.flagship.equipment_booking.allocation.AllocationCandidate;
import com.flagship.equipment_booking.allocation.AllocationRequest;
import com.flagship.equipment_booking.allocation.AllocationResult;
import com.flagship.equipment_booking.allocation.QuantityAllocator;
import com.flagship.equipment_booking.asset.Asset;
import com.flagship.equipment_booking.asset.AssetPatch;
import com.flagship.equipment_booking.asset.AssetStatus;
import com.flagship.equipment_booking.asset.InUseBy;
import com.flagship.equipment_booking.availability.AvailabilityChecker;
import com.flagship.equipment_booking.availability.TimeWindow;
import com.flagship.equipment_booking.exception.ResourceNotFoundException;
import com.flagship.equipment_booking.exception.ResourceUnavailableException;
import com.flagship.equipment_booking.group.AssetGroup;
import com.flagship.equipment_booking.history.ChangeEntry;
import com.flagship.equipment_booking.history.ChangeHistoryRecorder;
import com.flagship.equipment_booking.history.FieldChange;
import com.flagship.equipment_booking.inventory.AssetFilter;
import com.flagship.equipment_booking.inventory.BookingFilter;
import com.flagship.equipment_booking.inventory.InventoryStore;
import com.flagship.equipment_booking.kit.BoundAsset;
import com.flagship.equipment_booking.kit.Kit;
import com.flagship.equipment_booking.kit.KitAvailabilityResolver;
import com.flagship.equipment_booking.kit.KitAvailabilityResult;
import com.flagship.equipment_booking.kit.KitType;
import com.flagship.equipment_booking.kit.PoolRequirement;
import com.flagship.equipment_booking.observability.BookingMetrics;
import com.flagship.equipment_booking.observability.CorrelationContext;
import com.flagship.equipment_booking.store.Actor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Booking lifecycle: create, approve, check out, check in, cancel, delete.
 *
 * Every step is read, decide, write against a store with single-record
 * atomicity only, so availability checks and the writes that depend on them
 * are not atomic. Bookings created directly as approved are re-checked after
 * the write and the later of two overlapping writes is cancelled (first
 * write wins). Concurrent approvals of overlapping pending bookings are not
 * resolved.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BookingService {

    static final String WRITE_CONFLICT_REASON = Booking.WRITE_CONFLICT_REASON;
    static final String NOT_AVAILABLE = "Asset is not available for the selected timeframe";

    /**
     * Write order of bookings: store-assigned creation time, then record id.
     */
    static final Comparator<Booking> WRITE_ORDER = Comparator
        .comparing(Booking::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(Booking::getId, Comparator.nullsLast(
            Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder())));

    private static final Comparator<Asset> BY_ASSET_NUMBER =
        Comparator.comparing(Asset::getAssetNumber, Comparator.nullsLast(Comparator.naturalOrder()));

    private final InventoryStore inventoryStore;
    private final AvailabilityChecker availabilityChecker;
    private final QuantityAllocator quantityAllocator;
    private final KitAvailabilityResolver kitAvailabilityResolver;
    private final BookingIdempotencyService idempotencyService;
    private final ChangeHistoryRecorder historyRecorder;
    private final BookingMetrics bookingMetrics;
    private final Clock clock;
    private final ZoneId bookingZone;

    // ==================== Queries ====================

    public Booking getBooking(String id) {
        return inventoryStore.getBooking(id);
    }

    public List<Booking> listBookings(BookingFilter filter) {
        return inventoryStore.getBookings(filter).stream()
            .sorted(Comparator.comparing(Booking::getStartDate, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();
    }

    public boolean isAssetAvailable(String assetId, Instant start, Instant end) {
        return availabilityChecker.isAvailable(assetId, start, end);
    }

    /**
     * Previews which children of a multi-unit asset would be allocated.
     */
    public AllocationResult allocateBookingQuantity(AllocationRequest request) {
        if (request.getEndDate().isBefore(request.getStartDate())) {
            throw new IllegalArgumentException("End date must be after the start date");
        }
        Asset parent = inventoryStore.getAsset(request.getParentAssetId());
        return allocateChildren(parent, request.getQuantity(),
            TimeWindow.of(request.getStartDate(), request.getEndDate()),
            request.getExcludeIds() == null ? List.of() : request.getExcludeIds());
    }

    // ==================== Create ====================

    /**
     * Creates a booking.
     *
     * Phase 1: validate the request (no store access)
     * Phase 2: replay an earlier create with the same request key
     * Phase 3: load the target and decide which assets the booking holds
     * Phase 4: write, then for approved bookings verify first write wins
     * Phase 5: remember the request key for the surviving booking
     *
     * @throws IllegalArgumentException for a missing target, bad quantity or bad dates
     * @throws IllegalStateException if the target's status blocks bookings
     * @throws ResourceUnavailableException if the target is not free for the window
     * @throws ResourceNotFoundException if the target does not exist
     */
    public Booking create(BookingCreate data) {
        long startTime = System.currentTimeMillis();
        BookingTarget target = validateTarget(data.getTarget());
        int quantity = validateQuantity(data.getQuantity());
        BookingMode mode = data.getBookingMode() == null ? BookingMode.DATE_RANGE : data.getBookingMode();
        TimeWindow window = resolveWindow(data, mode);
        BookingStatus initialStatus = validateInitialStatus(data.getInitialStatus());

        if (data.getRequestKey() != null) {
            Optional<Booking> existing = idempotencyService.findExisting(data.getRequestKey());
            if (existing.isPresent()) {
                bookingMetrics.incrementDuplicateRequests();
                log.info("Request key {} already used, returning booking {}", data.getRequestKey(), existing.get().getId());
                return existing.get();
            }
        }

        try {
            List<String> held = switch (target.getType()) {
                case KIT -> reserveKit(target.getKitId(), quantity, window);
                case GROUP_MEMBER -> reserveGroupMember(target, quantity, window);
                case ASSET -> reserveAsset(inventoryStore.getAsset(target.getAssetId()), quantity, window);
            };

            Actor actor = inventoryStore.getCurrentActor();
            Instant now = clock.instant();

            Booking.BookingBuilder draft = Booking.builder()
                .target(target)
                .quantity(quantity)
                .allocatedChildAssets(isDirectHold(target, held) ? List.of() : held)
                .bookingMode(mode)
                .startDate(window.getStart())
                .endDate(window.getEnd())
                .date(data.getDate())
                .startTime(data.getStartTime())
                .endTime(data.getEndTime())
                .purpose(data.getPurpose())
                .notes(data.getNotes())
                .status(initialStatus)
                .bookedById(actor.getId())
                .bookedByName(actor.getName())
                .requestKey(data.getRequestKey());
            if (initialStatus == BookingStatus.APPROVED) {
                draft.approvedById(actor.getId()).approvedByName(actor.getName()).approvedAt(now);
            }

            Booking saved = inventoryStore.createBookingRecord(draft.build());
            MDC.put(CorrelationContext.BOOKING_ID_MDC_KEY, saved.getId());

            if (saved.isBlocking()) {
                verifyFirstWriteWins(saved, actor);
            }

            // Only a booking that survived the write-time check answers later retries
            if (data.getRequestKey() != null) {
                idempotencyService.remember(data.getRequestKey(), saved.getId());
            }

            historyRecorder.record(ChangeEntry.of("booking", saved.getId(), "created", actor, now)
                .toBuilder()
                .changes(List.of(FieldChange.of("status", null, saved.getStatus().value())))
                .build());

            bookingMetrics.recordBookingCreated(target.getType().value(), saved.getStatus().value());
            bookingMetrics.recordLatency("create", System.currentTimeMillis() - startTime);
            log.info("Booking created: target={}, status={}, heldAssets={}",
                target.getType().value(), saved.getStatus().value(), saved.heldAssetIds());
            return saved;

        } catch (ResourceUnavailableException | IllegalStateException e) {
            bookingMetrics.recordBookingRejected(e instanceof ResourceUnavailableException ? "unavailable" : "state");
            log.warn("Booking rejected: {}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.BOOKING_ID_MDC_KEY);
        }
    }

    /**
     * Books each requested group member with the same template.
     *
     * Duplicate ids are collapsed. A member failure is collected, not thrown;
     * with {@code stopOnError} the loop ends at the first failure. There is no
     * all-or-nothing guarantee.
     *
     * @throws ResourceNotFoundException if the group does not exist
     */
    public GroupBookingResult createGroupBooking(String groupId, List<String> assetIds,
                                                 BookingCreate template, boolean stopOnError) {
        AssetGroup group = inventoryStore.getAssetGroup(groupId)
            .orElseThrow(() -> new ResourceNotFoundException("Asset group", groupId));

        List<GroupBookingResult.Success> successes = new ArrayList<>();
        List<GroupBookingResult.Failure> failures = new ArrayList<>();

        for (String assetId : new LinkedHashSet<>(assetIds)) {
            if (!group.hasMember(assetId)) {
                failures.add(new GroupBookingResult.Failure(assetId, "Asset is not a member of this group"));
                if (stopOnError) {
                    break;
                }
                continue;
            }

            BookingCreate memberBooking = template.toBuilder()
                .target(BookingTarget.groupMember(groupId, assetId))
                .quantity(1)
                .requestKey(template.getRequestKey() == null ? null : template.getRequestKey() + ":" + assetId)
                .build();

            try {
                successes.add(new GroupBookingResult.Success(assetId, create(memberBooking)));
            } catch (RuntimeException e) {
                log.warn("Group booking failed for asset {} in group {}: {}", assetId, groupId, e.getMessage());
                failures.add(new GroupBookingResult.Failure(assetId, e.getMessage()));
                if (stopOnError) {
                    break;
                }
            }
        }

        log.info("Group booking for group {}: {} succeeded, {} failed", groupId, successes.size(), failures.size());
        return new GroupBookingResult(List.copyOf(successes), List.copyOf(failures));
    }

    // ==================== Transitions ====================

    /**
     * pending -> approved. The held assets are re-checked for the window,
     * ignoring this booking itself.
     */
    public Booking approve(String bookingId) {
        Booking booking = inventoryStore.getBooking(bookingId);
        Actor actor = inventoryStore.getCurrentActor();
        Booking approved = booking.approve(actor, clock.instant());

        List<String> blocked = new ArrayList<>();
        for (String assetId : booking.heldAssetIds()) {
            inventoryStore.findAsset(assetId).ifPresent(this::ensureBookableStatus);
            if (!availabilityChecker.isAvailable(assetId, booking.getStartDate(), booking.getEndDate(), bookingId)) {
                blocked.add(assetId);
            }
        }
        if (!blocked.isEmpty()) {
            bookingMetrics.recordBookingRejected("unavailable");
            throw new ResourceUnavailableException(NOT_AVAILABLE, blocked);
        }

        Booking saved = inventoryStore.updateBookingRecord(bookingId, approved);
        recordTransition(saved, BookingAction.APPROVE, booking.getStatus(), actor, null);
        return saved;
    }

    /**
     * approved -> active. Held assets go in-use, held by the acting user.
     */
    public Booking checkOut(String bookingId, ConditionAssessment condition) {
        Booking booking = inventoryStore.getBooking(bookingId);
        Actor actor = inventoryStore.getCurrentActor();
        Instant now = clock.instant();

        Booking active = booking.checkOut(actor, now, condition);
        Booking saved = inventoryStore.updateBookingRecord(bookingId, active);

        AssetPatch inUse = AssetPatch.builder()
            .status(AssetStatus.IN_USE)
            .inUseBy(InUseBy.builder().personId(actor.getId()).personName(actor.getName()).since(now).build())
            .currentBookingId(bookingId)
            .build();
        for (String assetId : saved.heldAssetIds()) {
            inventoryStore.updateAsset(assetId, inUse);
        }

        recordTransition(saved, BookingAction.CHECK_OUT, booking.getStatus(), actor, null);
        return saved;
    }

    /**
     * active -> completed. A poor or damaged rating sends the held assets to
     * broken, anything else returns them to available.
     */
    public Booking checkIn(String bookingId, ConditionAssessment condition) {
        if (condition == null || condition.getRating() == null) {
            throw new IllegalArgumentException("A condition assessment with a rating is required to check in");
        }

        Booking booking = inventoryStore.getBooking(bookingId);
        Actor actor = inventoryStore.getCurrentActor();

        Booking completed = booking.checkIn(actor, clock.instant(), condition);
        Booking saved = inventoryStore.updateBookingRecord(bookingId, completed);

        AssetPatch returned = condition.getRating().indicatesDamage()
            ? AssetPatch.release().toBuilder().status(AssetStatus.BROKEN).build()
            : AssetPatch.release();
        for (String assetId : saved.heldAssetIds()) {
            inventoryStore.updateAsset(assetId, returned);
        }

        if (saved.isDamageReported()) {
            log.warn("Damage reported on check-in of booking {}: {}", bookingId, saved.getDamageNotes());
        }
        recordTransition(saved, BookingAction.CHECK_IN, booking.getStatus(), actor, null);
        return saved;
    }

    /**
     * Cancels a pending, approved or active booking. Assets of an active
     * booking are released before the booking is marked cancelled.
     */
    public Booking cancel(String bookingId, String reason) {
        Booking booking = inventoryStore.getBooking(bookingId);
        Booking cancelled = booking.cancel(reason);
        Actor actor = inventoryStore.getCurrentActor();

        if (booking.getStatus() == BookingStatus.ACTIVE) {
            for (String assetId : booking.heldAssetIds()) {
                inventoryStore.updateAsset(assetId, AssetPatch.release());
            }
        }

        Booking saved = inventoryStore.updateBookingRecord(bookingId, cancelled);
        recordTransition(saved, BookingAction.CANCEL, booking.getStatus(), actor, reason);
        return saved;
    }

    /**
     * Hard-deletes a booking. Unknown ids are ignored.
     *
     * Only held assets still checked out under this booking are reset to
     * available; an asset that is broken, retired or in use under another
     * booking keeps its state. A failed reset is logged and does not fail
     * the delete.
     */
    public void delete(String bookingId) {
        Optional<Booking> existing = inventoryStore.findBooking(bookingId);
        if (existing.isEmpty()) {
            log.debug("Delete of unknown booking {} ignored", bookingId);
            return;
        }

        try (MDC.MDCCloseable ignored = CorrelationContext.bookingScope(bookingId)) {
            Booking booking = existing.get();
            inventoryStore.deleteBookingRecord(bookingId);

            for (String assetId : booking.heldAssetIds()) {
                try {
                    releaseIfHeldBy(assetId, bookingId);
                } catch (RuntimeException e) {
                    log.warn("Failed to reset asset {} after deleting booking {}: {}", assetId, bookingId, e.getMessage());
                }
            }

            historyRecorder.record(ChangeEntry.of("booking", bookingId, "deleted",
                inventoryStore.getCurrentActor(), clock.instant()));
            log.info("Booking deleted: bookingId={}, status={}", bookingId, booking.getStatus().value());
        }
    }

    private void releaseIfHeldBy(String assetId, String bookingId) {
        Optional<Asset> asset = inventoryStore.findAsset(assetId);
        if (asset.isEmpty()) {
            log.warn("Asset {} of deleted booking {} no longer exists", assetId, bookingId);
            return;
        }
        if (!bookingId.equals(asset.get().getCurrentBookingId())) {
            return;
        }
        inventoryStore.updateAsset(assetId, AssetPatch.release());
    }

    // ==================== Validation ====================

    private BookingTarget validateTarget(BookingTarget target) {
        if (target == null) {
            throw new IllegalArgumentException("target is required: a booking needs an asset or a kit");
        }

        BookingTargetType type = target.getType();
        if (type == null) {
            type = target.getKitId() != null ? BookingTargetType.KIT : BookingTargetType.ASSET;
        }

        switch (type) {
            case KIT -> {
                if (target.getKitId() == null || target.getKitId().isBlank()) {
                    throw new IllegalArgumentException("target.kitId is required for kit bookings");
                }
                return BookingTarget.kit(target.getKitId());
            }
            case GROUP_MEMBER -> {
                if (target.getGroupId() == null || target.getAssetId() == null) {
                    throw new IllegalArgumentException("target.groupId and target.assetId are required for group member bookings");
                }
                return BookingTarget.groupMember(target.getGroupId(), target.getAssetId());
            }
            default -> {
                if (target.getAssetId() == null || target.getAssetId().isBlank()) {
                    throw new IllegalArgumentException("target is required: a booking needs an asset or a kit");
                }
                return BookingTarget.asset(target.getAssetId());
            }
        }
    }

    private int validateQuantity(Integer quantity) {
        int value = quantity == null ? 1 : quantity;
        if (value < 1) {
            throw new IllegalArgumentException("quantity must be at least 1");
        }
        return value;
    }

    /**
     * Date-range bookings need end after start. Single-day bookings may
     * start and end at the same instant.
     */
    private TimeWindow resolveWindow(BookingCreate data, BookingMode mode) {
        Instant start = data.getStartDate();
        Instant end = data.getEndDate();

        if (mode == BookingMode.SINGLE_DAY && data.getDate() != null) {
            LocalTime from = data.getStartTime() == null ? LocalTime.MIN : data.getStartTime();
            LocalTime to = data.getEndTime() == null ? LocalTime.MAX : data.getEndTime();
            start = data.getDate().atTime(from).atZone(bookingZone).toInstant();
            end = data.getDate().atTime(to).atZone(bookingZone).toInstant();
        }

        if (start == null || end == null) {
            throw new IllegalArgumentException(mode == BookingMode.SINGLE_DAY
                ? "date (or startDate and endDate) is required for single-day bookings"
                : "startDate and endDate are required");
        }

        boolean ordered = mode == BookingMode.SINGLE_DAY ? !end.isBefore(start) : end.isAfter(start);
        if (!ordered) {
            throw new IllegalArgumentException("End date must be after the start date");
        }
        return TimeWindow.of(start, end);
    }

    private BookingStatus validateInitialStatus(BookingStatus status) {
        if (status == null) {
            return BookingStatus.PENDING;
        }
        if (status != BookingStatus.PENDING && status != BookingStatus.APPROVED) {
            throw new IllegalArgumentException("initialStatus must be pending or approved, not " + status.value());
        }
        return status;
    }

    private void ensureBookableStatus(Asset asset) {
        if (asset.getStatus().blocksBooking()) {
            throw new IllegalStateException("Asset cannot be booked (status: " + asset.getStatus().value() + ")");
        }
    }

    // ==================== Reservation ====================

    private List<String> reserveAsset(Asset asset, int quantity, TimeWindow window) {
        try (MDC.MDCCloseable ignored = CorrelationContext.assetScope(asset.getId())) {
            ensureBookableStatus(asset);

            if (asset.isMultiUnit()) {
                AllocationResult allocation = allocateChildren(asset, quantity, window, List.of());
                if (!allocation.isFulfilled()) {
                    throw new ResourceUnavailableException(allocation.getShortage().getMessage(),
                        List.of(asset.getId()));
                }
                return allocation.allocatedIds();
            }

            if (quantity != 1) {
                throw new IllegalArgumentException(String.format(
                    "quantity must be 1 for asset %s, which is a single item", asset.getAssetNumber()));
            }
            if (!asset.isBookable()) {
                throw new IllegalStateException("Asset " + asset.getAssetNumber() + " is not bookable");
            }
            if (!availabilityChecker.isAvailable(asset.getId(), window.getStart(), window.getEnd())) {
                throw new ResourceUnavailableException(NOT_AVAILABLE, List.of(asset.getId()));
            }
            return List.of(asset.getId());
        }
    }

    private List<String> reserveGroupMember(BookingTarget target, int quantity, TimeWindow window) {
        AssetGroup group = inventoryStore.getAssetGroup(target.getGroupId())
            .orElseThrow(() -> new ResourceNotFoundException("Asset group", target.getGroupId()));
        if (!group.hasMember(target.getAssetId())) {
            throw new IllegalArgumentException("Asset is not a member of this group");
        }
        return reserveAsset(inventoryStore.getAsset(target.getAssetId()), quantity, window);
    }

    private List<String> reserveKit(String kitId, int quantity, TimeWindow window) {
        if (quantity != 1) {
            throw new IllegalArgumentException("quantity must be 1 for kit bookings");
        }
        Kit kit = inventoryStore.getKit(kitId)
            .orElseThrow(() -> new ResourceNotFoundException("Kit", kitId));

        if (kit.getType() == KitType.FIXED) {
            for (BoundAsset bound : kit.getBoundAssets()) {
                inventoryStore.findAsset(bound.getAssetId()).ifPresent(this::ensureBookableStatus);
            }
        }

        KitAvailabilityResult availability = kitAvailabilityResolver.check(kit, window.getStart(), window.getEnd());
        if (!availability.isAvailable()) {
            throw new ResourceUnavailableException(availability.getReason(),
                availability.getUnavailableAssets() == null ? List.of() : availability.getUnavailableAssets());
        }

        if (kit.getType() == KitType.FIXED) {
            return kit.getBoundAssets().stream().map(BoundAsset::getAssetId).toList();
        }

        List<String> allocated = new ArrayList<>();
        for (PoolRequirement pool : kit.getPoolRequirements()) {
            List<AllocationCandidate> candidates = kitAvailabilityResolver.poolMembers(pool).stream()
                .sorted(BY_ASSET_NUMBER)
                .map(asset -> AllocationCandidate.from(asset,
                    availabilityChecker.isAvailable(asset.getId(), window.getStart(), window.getEnd())))
                .toList();

            AllocationResult result = quantityAllocator.allocate(pool.getQuantity(), null, candidates, allocated);
            bookingMetrics.recordAllocation(result.getStatus().value());
            if (!result.isFulfilled()) {
                throw new ResourceUnavailableException(String.format(
                    "Insufficient assets in pool %s: %s", pool.displayName(), result.getShortage().getMessage()));
            }
            allocated.addAll(result.allocatedIds());
        }
        return allocated;
    }

    private AllocationResult allocateChildren(Asset parent, int quantity, TimeWindow window, Collection<String> excludeIds) {
        List<AllocationCandidate> candidates = inventoryStore.getAssets(AssetFilter.childrenOf(parent.getId())).stream()
            .sorted(BY_ASSET_NUMBER)
            .map(child -> AllocationCandidate.from(child,
                availabilityChecker.isAvailable(child.getId(), window.getStart(), window.getEnd())))
            .toList();

        AllocationResult result = quantityAllocator.allocate(quantity, parent.getId(), candidates, excludeIds);
        bookingMetrics.recordAllocation(result.getStatus().value());
        return result;
    }

    /**
     * A plain single-asset booking holds its target; everything else records
     * the held items explicitly.
     */
    private boolean isDirectHold(BookingTarget target, List<String> held) {
        return target.getAssetId() != null && held.size() == 1 && held.get(0).equals(target.getAssetId());
    }

    // ==================== Write-time conflict resolution ====================

    /**
     * Re-reads the blocking bookings that overlap a freshly written one. If
     * any of them was written earlier, the new booking loses: it is rewritten
     * as cancelled and the caller gets an availability error.
     */
    private void verifyFirstWriteWins(Booking saved, Actor actor) {
        Set<String> conflictingAssets = new LinkedHashSet<>();
        for (String assetId : saved.heldAssetIds()) {
            boolean lost = availabilityChecker.findBlockingBookings(assetId, saved.window(), saved.getId()).stream()
                .anyMatch(other -> WRITE_ORDER.compare(other, saved) < 0);
            if (lost) {
                conflictingAssets.add(assetId);
            }
        }

        if (conflictingAssets.isEmpty()) {
            return;
        }

        Booking cancelled = saved.cancel(WRITE_CONFLICT_REASON);
        inventoryStore.updateBookingRecord(saved.getId(), cancelled);
        bookingMetrics.incrementWriteConflicts();
        historyRecorder.record(ChangeEntry.of("booking", saved.getId(), "cancelled", actor, clock.instant())
            .toBuilder()
            .changes(List.of(FieldChange.of("status", saved.getStatus().value(), BookingStatus.CANCELLED.value())))
            .note(WRITE_CONFLICT_REASON)
            .build());

        log.warn("Booking {} lost a write-time conflict on assets {}", saved.getId(), conflictingAssets);
        throw new ResourceUnavailableException(NOT_AVAILABLE, List.copyOf(conflictingAssets));
    }

    // ==================== History ====================

    private void recordTransition(Booking saved, BookingAction action, BookingStatus from, Actor actor, String note) {
        List<FieldChange> changes = new ArrayList<>();
        changes.add(FieldChange.of("status", from.value(), saved.getStatus().value()));
        if (note != null) {
            changes.add(FieldChange.of("cancellationReason", "", note));
        }

        historyRecorder.record(ChangeEntry.of("booking", saved.getId(), saved.getStatus().value(), actor, clock.instant())
            .toBuilder()
            .changes(changes)
            .note(note)
            .build());

        bookingMetrics.recordTransition(action.name().toLowerCase());
        log.info("Booking {} {}: {} -> {}", saved.getId(), action.verb(), from.value(), saved.getStatus().value());
    }
}
