package com.flagship.equipment_booking.booking;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.equipment_booking.availability.TimeWindow;
import com.flagship.equipment_booking.store.Actor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * Immutable booking. Lifecycle changes go through the methods below, which
 * consult {@link BookingStateMachine} and return a new instance.
 *
 * startDate/endDate are always set: for single-day bookings they are derived
 * from date + startTime/endTime when the booking is created.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Booking {

    public static final String WRITE_CONFLICT_REASON = "Conflicting booking detected at write time";

    String id;
    BookingTarget target;
    @Builder.Default
    int quantity = 1;
    @Builder.Default
    List<String> allocatedChildAssets = List.of();

    @Builder.Default
    BookingMode bookingMode = BookingMode.DATE_RANGE;
    Instant startDate;
    Instant endDate;
    LocalDate date;
    LocalTime startTime;
    LocalTime endTime;

    String purpose;
    String notes;

    @Builder.Default
    BookingStatus status = BookingStatus.PENDING;

    String bookedById;
    String bookedByName;

    String approvedById;
    String approvedByName;
    Instant approvedAt;

    String checkedOutById;
    String checkedOutByName;
    Instant checkedOutAt;
    ConditionAssessment checkOutCondition;

    String checkedInById;
    String checkedInByName;
    Instant checkedInAt;
    ConditionAssessment checkInCondition;

    boolean damageReported;
    String damageNotes;

    String cancellationReason;
    String requestKey;
    Instant createdAt;

    /**
     * Asset ids this booking occupies: the allocated items when there are
     * any, otherwise the single target asset.
     */
    public List<String> heldAssetIds() {
        if (allocatedChildAssets != null && !allocatedChildAssets.isEmpty()) {
            return allocatedChildAssets;
        }
        if (target != null && target.getAssetId() != null) {
            return List.of(target.getAssetId());
        }
        return List.of();
    }

    public boolean holds(String assetId) {
        return heldAssetIds().contains(assetId);
    }

    /**
     * True when the booking targets the asset or holds it. A quantity booking
     * references its multi-unit parent as well as the allocated items.
     */
    public boolean references(String assetId) {
        return holds(assetId) || (target != null && assetId.equals(target.getAssetId()));
    }

    /**
     * True for a booking that was cancelled because an earlier overlapping
     * write won. Such a booking never counted as created.
     */
    @JsonIgnore
    public boolean isWriteConflictLoser() {
        return status == BookingStatus.CANCELLED && WRITE_CONFLICT_REASON.equals(cancellationReason);
    }

    public TimeWindow window() {
        return TimeWindow.of(startDate, endDate);
    }

    @JsonIgnore
    public boolean isBlocking() {
        return status != null && status.isBlocking();
    }

    public Booking approve(Actor actor, Instant at) {
        BookingStatus next = BookingStateMachine.transition(status, BookingAction.APPROVE).orElseThrow();
        return toBuilder()
            .status(next)
            .approvedById(actor.getId())
            .approvedByName(actor.getName())
            .approvedAt(at)
            .build();
    }

    public Booking checkOut(Actor actor, Instant at, ConditionAssessment condition) {
        BookingStatus next = BookingStateMachine.transition(status, BookingAction.CHECK_OUT).orElseThrow();
        return toBuilder()
            .status(next)
            .checkedOutById(actor.getId())
            .checkedOutByName(actor.getName())
            .checkedOutAt(at)
            .checkOutCondition(condition)
            .build();
    }

    /**
     * Completes the booking. A poor or damaged rating flags the booking as
     * having reported damage.
     */
    public Booking checkIn(Actor actor, Instant at, ConditionAssessment condition) {
        BookingStatus next = BookingStateMachine.transition(status, BookingAction.CHECK_IN).orElseThrow();
        boolean damaged = condition.getRating() != null && condition.getRating().indicatesDamage();
        return toBuilder()
            .status(next)
            .checkedInById(actor.getId())
            .checkedInByName(actor.getName())
            .checkedInAt(at)
            .checkInCondition(condition)
            .damageReported(damaged || damageReported)
            .damageNotes(damaged ? condition.getNotes() : damageNotes)
            .build();
    }

    public Booking cancel(String reason) {
        BookingStatus next = BookingStateMachine.transition(status, BookingAction.CANCEL).orElseThrow();
        return toBuilder()
            .status(next)
            .cancellationReason(reason)
            .build();
    }
}
