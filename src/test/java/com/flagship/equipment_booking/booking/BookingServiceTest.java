package com.flagship.equipment_booking.booking;

import com.flagship.equipment_booking.allocation.AllocationRequest;
import com.flagship.equipment_booking.allocation.AllocationResult;
import com.flagship.equipment_booking.asset.Asset;
import com.flagship.equipment_booking.asset.AssetPatch;
import com.flagship.equipment_booking.asset.AssetStatus;
import com.flagship.equipment_booking.exception.ResourceNotFoundException;
import com.flagship.equipment_booking.exception.ResourceUnavailableException;
import com.flagship.equipment_booking.history.ChangeEntry;
import com.flagship.equipment_booking.inventory.BookingFilter;
import com.flagship.equipment_booking.kit.BoundAsset;
import com.flagship.equipment_booking.kit.Kit;
import com.flagship.equipment_booking.kit.KitType;
import com.flagship.equipment_booking.kit.PoolRequirement;
import com.flagship.equipment_booking.store.Actor;
import com.flagship.equipment_booking.store.codec.RecordKind;
import com.flagship.equipment_booking.support.InventoryFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Booking lifecycle against the real services and an in-memory record store.
 */
class BookingServiceTest {

    private static final Instant START = Instant.parse("2025-10-25T09:00:00Z");
    private static final Instant END = Instant.parse("2025-10-25T17:00:00Z");

    private InventoryFixture fixture;
    private BookingService bookingService;
    private Asset camera;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    @BeforeEach
    void setUp() {
        fixture = new InventoryFixture();
        bookingService = fixture.bookingService;
        camera = fixture.asset("CAM-001");
    }

    private BookingCreate.BookingCreateBuilder request(BookingTarget target) {
        return BookingCreate.builder().target(target).startDate(START).endDate(END).purpose("Shoot");
    }

    private Booking book(Asset asset) {
        return bookingService.create(request(BookingTarget.asset(asset.getId())).build());
    }

    private Booking bookApproved(Asset asset) {
        return bookingService.create(request(BookingTarget.asset(asset.getId()))
            .initialStatus(BookingStatus.APPROVED)
            .build());
    }

    private int storedBookings() {
        return fixture.recordStore.listRecords(RecordKind.BOOKING.category()).size();
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Missing target is rejected before anything is written")
        void testMissingTarget() {
            printTestHeader("Missing Target");

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> bookingService.create(BookingCreate.builder().startDate(START).endDate(END).build()));

            printExpectedException("IllegalArgumentException", e.getMessage());
            assertTrue(e.getMessage().contains("target"));
            assertEquals(0, storedBookings());
        }

        @Test
        @DisplayName("End before start is rejected")
        void testEndBeforeStart() {
            printTestHeader("End Before Start");

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> bookingService.create(request(BookingTarget.asset(camera.getId()))
                    .startDate(END).endDate(START).build()));

            assertEquals("End date must be after the start date", e.getMessage());
            assertEquals(0, storedBookings());
        }

        @Test
        @DisplayName("Date-range booking may not start and end at the same instant")
        void testEmptyDateRange() {
            printTestHeader("Empty Date Range");

            assertThrows(IllegalArgumentException.class,
                () -> bookingService.create(request(BookingTarget.asset(camera.getId())).endDate(START).build()));
        }

        @Test
        @DisplayName("Quantity below 1 is rejected")
        void testQuantityBelowOne() {
            printTestHeader("Quantity Below One");

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> bookingService.create(request(BookingTarget.asset(camera.getId())).quantity(0).build()));
            assertTrue(e.getMessage().contains("quantity"));
        }

        @Test
        @DisplayName("Bookings can only start out pending or approved")
        void testInitialStatus() {
            printTestHeader("Initial Status");

            assertThrows(IllegalArgumentException.class,
                () -> bookingService.create(request(BookingTarget.asset(camera.getId()))
                    .initialStatus(BookingStatus.ACTIVE).build()));
        }

        @Test
        @DisplayName("Unknown asset is a not-found error, not an availability error")
        void testUnknownAsset() {
            printTestHeader("Unknown Asset");

            assertThrows(ResourceNotFoundException.class,
                () -> bookingService.create(request(BookingTarget.asset("999")).build()));
        }
    }

    @Nested
    @DisplayName("Single assets")
    class SingleAssets {

        @Test
        @DisplayName("Pending booking is created with the actor's stamp")
        void testCreatePending() {
            printTestHeader("Create Pending Booking");

            Booking booking = book(camera);

            printOutput("Booking", booking);
            assertNotNull(booking.getId());
            assertEquals(BookingStatus.PENDING, booking.getStatus());
            assertEquals("user-1", booking.getBookedById());
            assertEquals("Test User", booking.getBookedByName());
            assertEquals(List.of(camera.getId()), booking.heldAssetIds());
            assertTrue(booking.getAllocatedChildAssets().isEmpty());
            assertNull(booking.getApprovedAt());

            List<ChangeEntry> history = fixture.history.entriesFor("booking", booking.getId());
            assertEquals(1, history.size());
            assertEquals("created", history.get(0).getAction());
            printSuccess("Booking created and recorded");
        }

        @Test
        @DisplayName("Booking created as approved carries approval stamps")
        void testCreateApproved() {
            printTestHeader("Create Approved Booking");

            Booking booking = bookApproved(camera);

            assertEquals(BookingStatus.APPROVED, booking.getStatus());
            assertEquals("user-1", booking.getApprovedById());
            assertEquals(InventoryFixture.NOW, booking.getApprovedAt());
        }

        @Test
        @DisplayName("Overlapping approved booking makes the asset unavailable")
        void testOverlapRejected() {
            printTestHeader("Overlap Rejected");

            bookApproved(camera);

            ResourceUnavailableException e = assertThrows(ResourceUnavailableException.class,
                () -> bookingService.create(request(BookingTarget.asset(camera.getId()))
                    .startDate(Instant.parse("2025-10-25T12:00:00Z"))
                    .endDate(Instant.parse("2025-10-25T13:00:00Z"))
                    .build()));

            printExpectedException("ResourceUnavailableException", e.getMessage());
            assertEquals(List.of(camera.getId()), e.getUnavailableAssetIds());
            assertEquals(1, storedBookings());
        }

        @Test
        @DisplayName("Pending bookings do not block each other")
        void testPendingDoesNotBlock() {
            printTestHeader("Pending Does Not Block");

            book(camera);
            Booking second = book(camera);

            assertEquals(BookingStatus.PENDING, second.getStatus());
            assertEquals(2, storedBookings());
        }

        @Test
        @DisplayName("Broken asset cannot be booked")
        void testBrokenAsset() {
            printTestHeader("Broken Asset");

            fixture.inventoryStore.updateAsset(camera.getId(), AssetPatch.builder().status(AssetStatus.BROKEN).build());

            IllegalStateException e = assertThrows(IllegalStateException.class, () -> book(camera));
            assertEquals("Asset cannot be booked (status: broken)", e.getMessage());
        }

        @Test
        @DisplayName("Deleted asset cannot be booked")
        void testDeletedAsset() {
            printTestHeader("Deleted Asset");

            fixture.assetService.deleteAsset(camera.getId());

            assertThrows(IllegalStateException.class, () -> book(camera));
        }

        @Test
        @DisplayName("Asset flagged not bookable is rejected")
        void testNotBookable() {
            printTestHeader("Not Bookable");

            fixture.inventoryStore.updateAsset(camera.getId(), AssetPatch.builder().bookable(false).build());

            assertThrows(IllegalStateException.class, () -> book(camera));
        }

        @Test
        @DisplayName("A single item cannot be booked more than once in one request")
        void testQuantityOnSingleAsset() {
            printTestHeader("Quantity On Single Asset");

            assertThrows(IllegalArgumentException.class,
                () -> bookingService.create(request(BookingTarget.asset(camera.getId())).quantity(2).build()));
        }

        @Test
        @DisplayName("Single-day booking derives its window from date and times")
        void testSingleDay() {
            printTestHeader("Single Day Booking");

            Booking booking = bookingService.create(BookingCreate.builder()
                .target(BookingTarget.asset(camera.getId()))
                .bookingMode(BookingMode.SINGLE_DAY)
                .date(LocalDate.of(2025, 10, 25))
                .startTime(LocalTime.of(9, 0))
                .endTime(LocalTime.of(12, 0))
                .build());

            printOutput("Window", booking.window());
            assertEquals(BookingMode.SINGLE_DAY, booking.getBookingMode());
            assertEquals(Instant.parse("2025-10-25T09:00:00Z"), booking.getStartDate());
            assertEquals(Instant.parse("2025-10-25T12:00:00Z"), booking.getEndDate());
            assertEquals(LocalDate.of(2025, 10, 25), booking.getDate());
        }

        @Test
        @DisplayName("Single-day booking may start and end at the same instant")
        void testSingleDayZeroLength() {
            printTestHeader("Single Day Zero Length");

            Booking booking = bookingService.create(request(BookingTarget.asset(camera.getId()))
                .bookingMode(BookingMode.SINGLE_DAY)
                .endDate(START)
                .build());

            assertEquals(booking.getStartDate(), booking.getEndDate());
        }

        @Test
        @DisplayName("Same request key returns the first booking instead of creating another")
        void testRequestKeyReplay() {
            printTestHeader("Request Key Replay");

            BookingCreate create = request(BookingTarget.asset(camera.getId())).requestKey("req-42").build();
            printInput("Request key", create.getRequestKey());

            Booking first = bookingService.create(create);
            Booking replay = bookingService.create(create);

            printOutput("First", first.getId());
            printOutput("Replay", replay.getId());
            assertEquals(first.getId(), replay.getId());
            assertEquals(1, storedBookings());
            assertEquals(1.0, fixture.meterRegistry.get("booking.duplicate_requests").counter().count());
        }
    }

    @Nested
    @DisplayName("Multi-unit assets")
    class MultiUnitAssets {

        private Asset parent;
        private Asset unit1;
        private Asset unit2;
        private Asset unit3;

        @BeforeEach
        void setUpUnits() {
            parent = fixture.asset("MIC-SET", "microphone");
            unit3 = fixture.childOf(parent, "MIC-003");
            unit1 = fixture.childOf(parent, "MIC-001");
            unit2 = fixture.childOf(parent, "MIC-002");
        }

        @Test
        @DisplayName("Quantity is served by the lowest-numbered free units")
        void testAllocateByAssetNumber() {
            printTestHeader("Allocate By Asset Number");

            Booking booking = bookingService.create(request(BookingTarget.asset(parent.getId())).quantity(2).build());

            printOutput("Allocated", booking.getAllocatedChildAssets());
            assertEquals(List.of(unit1.getId(), unit2.getId()), booking.getAllocatedChildAssets());
            assertEquals(2, booking.getQuantity());
            assertTrue(booking.holds(unit1.getId()));
            assertFalse(booking.holds(parent.getId()));
        }

        @Test
        @DisplayName("Units held by an approved booking are skipped")
        void testBusyUnitsSkipped() {
            printTestHeader("Busy Units Skipped");

            bookingService.create(request(BookingTarget.asset(parent.getId()))
                .quantity(1).initialStatus(BookingStatus.APPROVED).build());
            Booking second = bookingService.create(request(BookingTarget.asset(parent.getId())).quantity(2).build());

            assertEquals(List.of(unit2.getId(), unit3.getId()), second.getAllocatedChildAssets());
        }

        @Test
        @DisplayName("Asking for more units than are free is an availability error")
        void testShortage() {
            printTestHeader("Multi-unit Shortage");

            ResourceUnavailableException e = assertThrows(ResourceUnavailableException.class,
                () -> bookingService.create(request(BookingTarget.asset(parent.getId())).quantity(4).build()));

            printExpectedException("ResourceUnavailableException", e.getMessage());
            assertEquals("Requested 4 items but only 3 available (1 missing).", e.getMessage());
            assertEquals(0, storedBookings());
        }

        @Test
        @DisplayName("Allocation preview honours exclusions and writes nothing")
        void testAllocationPreview() {
            printTestHeader("Allocation Preview");

            AllocationResult result = bookingService.allocateBookingQuantity(AllocationRequest.builder()
                .parentAssetId(parent.getId())
                .quantity(2)
                .startDate(START)
                .endDate(END)
                .excludeIds(List.of(unit1.getId()))
                .build());

            assertTrue(result.isFulfilled());
            assertEquals(List.of(unit2.getId(), unit3.getId()), result.allocatedIds());
            assertEquals(0, storedBookings());
        }

        @Test
        @DisplayName("Check-out puts every allocated unit in use")
        void testCheckOutUnits() {
            printTestHeader("Check Out Units");

            Booking booking = bookingService.create(request(BookingTarget.asset(parent.getId()))
                .quantity(2).initialStatus(BookingStatus.APPROVED).build());
            bookingService.checkOut(booking.getId(), null);

            assertEquals(AssetStatus.IN_USE, fixture.reload(unit1).getStatus());
            assertEquals(AssetStatus.IN_USE, fixture.reload(unit2).getStatus());
            assertEquals(AssetStatus.AVAILABLE, fixture.reload(unit3).getStatus());
            assertEquals(AssetStatus.AVAILABLE, fixture.reload(parent).getStatus());
        }
    }

    @Nested
    @DisplayName("Kits")
    class Kits {

        @Test
        @DisplayName("Fixed kit booking holds every bound asset")
        void testFixedKit() {
            printTestHeader("Fixed Kit Booking");

            Asset tripod = fixture.asset("TRI-001");
            Kit kit = fixture.kitService.createKit(Kit.builder()
                .name("Interview kit")
                .type(KitType.FIXED)
                .boundAssets(List.of(
                    BoundAsset.builder().assetId(camera.getId()).build(),
                    BoundAsset.builder().assetId(tripod.getId()).build()))
                .build());

            Booking booking = bookingService.create(request(BookingTarget.kit(kit.getId())).build());

            assertEquals(BookingTargetType.KIT, booking.getTarget().getType());
            assertEquals(List.of(camera.getId(), tripod.getId()), booking.heldAssetIds());
        }

        @Test
        @DisplayName("Busy bound asset makes the kit unavailable and is named")
        void testFixedKitBusy() {
            printTestHeader("Fixed Kit Busy");

            Asset tripod = fixture.asset("TRI-001");
            Kit kit = fixture.kitService.createKit(Kit.builder()
                .name("Interview kit")
                .type(KitType.FIXED)
                .boundAssets(List.of(
                    BoundAsset.builder().assetId(camera.getId()).build(),
                    BoundAsset.builder().assetId(tripod.getId()).build()))
                .build());
            bookApproved(tripod);

            ResourceUnavailableException e = assertThrows(ResourceUnavailableException.class,
                () -> bookingService.create(request(BookingTarget.kit(kit.getId())).build()));

            printExpectedException("ResourceUnavailableException", e.getMessage());
            assertEquals("1 asset(s) unavailable", e.getMessage());
            assertEquals(List.of(tripod.getId()), e.getUnavailableAssetIds());
        }

        @Test
        @DisplayName("Broken bound asset blocks the kit with a state error")
        void testFixedKitBrokenAsset() {
            printTestHeader("Fixed Kit Broken Asset");

            Kit kit = fixture.kitService.createKit(Kit.builder()
                .name("Solo kit")
                .type(KitType.FIXED)
                .boundAssets(List.of(BoundAsset.builder().assetId(camera.getId()).build()))
                .build());
            fixture.inventoryStore.updateAsset(camera.getId(), AssetPatch.builder().status(AssetStatus.SOLD).build());

            assertThrows(IllegalStateException.class,
                () -> bookingService.create(request(BookingTarget.kit(kit.getId())).build()));
        }

        @Test
        @DisplayName("Flexible kit allocates matching assets per pool without reusing any")
        void testFlexibleKit() {
            printTestHeader("Flexible Kit Booking");

            Asset lensB = fixture.assetService.createAsset(Asset.builder()
                .assetNumber("LNS-002").assetTypeId("lens").customFieldValues(Map.of("mount", "EF")).build());
            Asset lensA = fixture.assetService.createAsset(Asset.builder()
                .assetNumber("LNS-001").assetTypeId("lens").customFieldValues(Map.of("mount", "EF")).build());

            Kit kit = fixture.kitService.createKit(Kit.builder()
                .name("Two lenses")
                .type(KitType.FLEXIBLE)
                .poolRequirements(List.of(
                    PoolRequirement.builder().assetTypeId("lens").quantity(1).filters(Map.of("mount", "EF")).build(),
                    PoolRequirement.builder().assetTypeId("lens").quantity(1).build()))
                .build());

            Booking booking = bookingService.create(request(BookingTarget.kit(kit.getId())).build());

            printOutput("Allocated", booking.getAllocatedChildAssets());
            assertEquals(List.of(lensA.getId(), lensB.getId()), booking.getAllocatedChildAssets());
        }

        @Test
        @DisplayName("Kit bookings are always for one kit")
        void testKitQuantity() {
            printTestHeader("Kit Quantity");

            assertThrows(IllegalArgumentException.class,
                () -> bookingService.create(request(BookingTarget.kit("1")).quantity(2).build()));
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Approve stamps the approver")
        void testApprove() {
            printTestHeader("Approve");

            Booking booking = book(camera);
            fixture.recordStore.setActor(Actor.of("mgr-1", "Manager"));

            Booking approved = bookingService.approve(booking.getId());

            assertEquals(BookingStatus.APPROVED, approved.getStatus());
            assertEquals("mgr-1", approved.getApprovedById());
            assertEquals("Manager", approved.getApprovedByName());
            assertEquals("user-1", approved.getBookedById());
        }

        @Test
        @DisplayName("Approving into an already approved window is rejected")
        void testApproveConflict() {
            printTestHeader("Approve Conflict");

            Booking first = book(camera);
            Booking second = book(camera);
            bookingService.approve(first.getId());

            assertThrows(ResourceUnavailableException.class, () -> bookingService.approve(second.getId()));
            assertEquals(BookingStatus.PENDING, bookingService.getBooking(second.getId()).getStatus());
        }

        @Test
        @DisplayName("Approving twice is a state error")
        void testApproveTwice() {
            printTestHeader("Approve Twice");

            Booking booking = bookApproved(camera);

            IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> bookingService.approve(booking.getId()));
            assertTrue(e.getMessage().contains("approved status"));
        }

        @Test
        @DisplayName("Check-out and check-in move the asset in and out of use")
        void testCheckOutAndIn() {
            printTestHeader("Check Out And In");

            Booking booking = bookApproved(camera);

            Booking active = bookingService.checkOut(booking.getId(),
                ConditionAssessment.builder().rating(ConditionRating.GOOD).build());
            Asset inUse = fixture.reload(camera);
            printOutput("Asset after check-out", inUse);
            assertEquals(BookingStatus.ACTIVE, active.getStatus());
            assertEquals(AssetStatus.IN_USE, inUse.getStatus());
            assertEquals(booking.getId(), inUse.getCurrentBookingId());
            assertEquals("user-1", inUse.getInUseBy().getPersonId());

            Booking completed = bookingService.checkIn(booking.getId(),
                ConditionAssessment.builder().rating(ConditionRating.FAIR).notes("Scuffed strap").build());
            Asset returned = fixture.reload(camera);
            assertEquals(BookingStatus.COMPLETED, completed.getStatus());
            assertFalse(completed.isDamageReported());
            assertEquals(AssetStatus.AVAILABLE, returned.getStatus());
            assertNull(returned.getCurrentBookingId());
            assertNull(returned.getInUseBy());
        }

        @Test
        @DisplayName("Damaged check-in marks the asset broken and flags the booking")
        void testDamagedCheckIn() {
            printTestHeader("Damaged Check In");

            Booking booking = bookApproved(camera);
            bookingService.checkOut(booking.getId(), null);

            Booking completed = bookingService.checkIn(booking.getId(),
                ConditionAssessment.builder().rating(ConditionRating.DAMAGED).notes("Cracked lens").build());

            assertTrue(completed.isDamageReported());
            assertEquals("Cracked lens", completed.getDamageNotes());
            assertEquals(AssetStatus.BROKEN, fixture.reload(camera).getStatus());
            assertThrows(IllegalStateException.class, () -> book(camera));
        }

        @Test
        @DisplayName("Check-in needs a condition rating")
        void testCheckInNeedsCondition() {
            printTestHeader("Check In Needs Condition");

            Booking booking = bookApproved(camera);
            bookingService.checkOut(booking.getId(), null);

            assertThrows(IllegalArgumentException.class, () -> bookingService.checkIn(booking.getId(), null));
            assertEquals(BookingStatus.ACTIVE, bookingService.getBooking(booking.getId()).getStatus());
        }

        @Test
        @DisplayName("Checking out a pending booking is a state error")
        void testCheckOutPending() {
            printTestHeader("Check Out Pending");

            Booking booking = book(camera);

            assertThrows(IllegalStateException.class, () -> bookingService.checkOut(booking.getId(), null));
            assertEquals(AssetStatus.AVAILABLE, fixture.reload(camera).getStatus());
        }

        @Test
        @DisplayName("Cancelling an active booking releases its assets")
        void testCancelActive() {
            printTestHeader("Cancel Active");

            Booking booking = bookApproved(camera);
            bookingService.checkOut(booking.getId(), null);

            Booking cancelled = bookingService.cancel(booking.getId(), "Shoot postponed");

            assertEquals(BookingStatus.CANCELLED, cancelled.getStatus());
            assertEquals("Shoot postponed", cancelled.getCancellationReason());
            assertEquals(AssetStatus.AVAILABLE, fixture.reload(camera).getStatus());
            assertTrue(bookingService.isAssetAvailable(camera.getId(), START, END));
        }

        @Test
        @DisplayName("Cancelled and completed bookings cannot be cancelled")
        void testCancelTerminal() {
            printTestHeader("Cancel Terminal");

            Booking booking = book(camera);
            bookingService.cancel(booking.getId(), null);

            IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> bookingService.cancel(booking.getId(), null));
            assertEquals("Booking is already cancelled", e.getMessage());
        }

        @Test
        @DisplayName("Unknown booking is a not-found error")
        void testUnknownBooking() {
            printTestHeader("Unknown Booking");

            assertThrows(ResourceNotFoundException.class, () -> bookingService.approve("404"));
        }

        @Test
        @DisplayName("Each transition is recorded in the history")
        void testHistory() {
            printTestHeader("Transition History");

            Booking booking = book(camera);
            bookingService.approve(booking.getId());
            bookingService.cancel(booking.getId(), "No longer needed");

            List<String> actions = fixture.history.entriesFor("booking", booking.getId()).stream()
                .map(ChangeEntry::getAction)
                .toList();
            printOutput("Actions", actions);
            assertEquals(List.of("created", "approved", "cancelled"), actions);
        }
    }

    @Nested
    @DisplayName("Delete")
    class Delete {

        @Test
        @DisplayName("Deleting a booking removes it and resets its assets")
        void testDelete() {
            printTestHeader("Delete Booking");

            Booking booking = bookApproved(camera);
            bookingService.checkOut(booking.getId(), null);

            bookingService.delete(booking.getId());

            assertEquals(0, storedBookings());
            assertEquals(AssetStatus.AVAILABLE, fixture.reload(camera).getStatus());
            assertNull(fixture.reload(camera).getCurrentBookingId());
        }

        @Test
        @DisplayName("Failing to reset an asset does not fail the delete")
        void testDeleteWithMissingAsset() {
            printTestHeader("Delete With Missing Asset");

            Booking booking = bookApproved(camera);
            fixture.recordStore.deleteRecord(RecordKind.ASSET.category(), camera.getId());

            assertDoesNotThrow(() -> bookingService.delete(booking.getId()));
            assertTrue(bookingService.listBookings(BookingFilter.all()).isEmpty());
        }

        @Test
        @DisplayName("Deleting a finished booking leaves a broken asset broken")
        void testDeleteKeepsBrokenAsset() {
            printTestHeader("Delete Keeps Broken Asset");

            Booking booking = bookApproved(camera);
            bookingService.checkOut(booking.getId(), null);
            bookingService.checkIn(booking.getId(),
                ConditionAssessment.builder().rating(ConditionRating.DAMAGED).notes("Cracked lens").build());

            bookingService.delete(booking.getId());

            Asset asset = fixture.reload(camera);
            printOutput("Asset after delete", asset);
            assertEquals(0, storedBookings());
            assertEquals(AssetStatus.BROKEN, asset.getStatus());
        }

        @Test
        @DisplayName("Deleting one booking does not release an asset checked out under another")
        void testDeleteKeepsOtherCheckOut() {
            printTestHeader("Delete Keeps Other Check-out");

            Booking earlier = bookApproved(camera);
            Booking later = bookingService.create(request(BookingTarget.asset(camera.getId()))
                .startDate(Instant.parse("2025-10-27T09:00:00Z"))
                .endDate(Instant.parse("2025-10-27T17:00:00Z"))
                .initialStatus(BookingStatus.APPROVED)
                .build());
            bookingService.checkOut(later.getId(), null);

            bookingService.delete(earlier.getId());

            Asset asset = fixture.reload(camera);
            printOutput("Asset after delete", asset);
            assertEquals(AssetStatus.IN_USE, asset.getStatus());
            assertEquals(later.getId(), asset.getCurrentBookingId());
            assertNotNull(asset.getInUseBy());
        }

        @Test
        @DisplayName("Deleting an unknown booking is a no-op")
        void testDeleteUnknown() {
            printTestHeader("Delete Unknown");

            assertDoesNotThrow(() -> bookingService.delete("404"));
            assertTrue(fixture.history.entries().stream().noneMatch(entry -> "deleted".equals(entry.getAction())));
        }
    }
}
