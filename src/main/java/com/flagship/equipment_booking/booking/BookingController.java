package com.flagship.equipment_booking.booking;

import com.flagship.equipment_booking.allocation.AllocationRequest;
import com.flagship.equipment_booking.allocation.AllocationResult;
import com.flagship.equipment_booking.booking.dto.CancelBookingRequest;
import com.flagship.equipment_booking.booking.dto.CreateBookingRequest;
import com.flagship.equipment_booking.inventory.BookingFilter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumSet;
import java.util.List;

/**
 * Booking endpoints.
 *
 * POST /api/bookings accepts an optional Idempotency-Key header. A retried
 * request with the same key returns the booking created the first time.
 */
@RestController
@RequestMapping("/api/bookings")
@RequiredArgsConstructor
public class BookingController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final BookingService bookingService;

    @PostMapping
    public ResponseEntity<Booking> createBooking(
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody CreateBookingRequest request) {
        String requestKey = idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey;
        Booking booking = bookingService.create(request.toCommand(requestKey));
        return ResponseEntity.status(HttpStatus.CREATED).body(booking);
    }

    @GetMapping("/{id}")
    public ResponseEntity<Booking> getBooking(@PathVariable("id") String id) {
        return ResponseEntity.ok(bookingService.getBooking(id));
    }

    @GetMapping
    public ResponseEntity<List<Booking>> listBookings(
            @RequestParam(value = "assetId", required = false) String assetId,
            @RequestParam(value = "kitId", required = false) String kitId,
            @RequestParam(value = "status", required = false) String status) {
        BookingFilter filter = BookingFilter.builder()
            .assetId(assetId)
            .kitId(kitId)
            .statuses(status == null ? null : EnumSet.of(BookingStatus.fromValue(status)))
            .build();
        return ResponseEntity.ok(bookingService.listBookings(filter));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<Booking> approve(@PathVariable("id") String id) {
        return ResponseEntity.ok(bookingService.approve(id));
    }

    @PostMapping("/{id}/check-out")
    public ResponseEntity<Booking> checkOut(
            @PathVariable("id") String id,
            @RequestBody(required = false) ConditionAssessment condition) {
        return ResponseEntity.ok(bookingService.checkOut(id, condition));
    }

    @PostMapping("/{id}/check-in")
    public ResponseEntity<Booking> checkIn(
            @PathVariable("id") String id,
            @RequestBody ConditionAssessment condition) {
        return ResponseEntity.ok(bookingService.checkIn(id, condition));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Booking> cancel(
            @PathVariable("id") String id,
            @RequestBody(required = false) CancelBookingRequest request) {
        return ResponseEntity.ok(bookingService.cancel(id, request == null ? null : request.getReason()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") String id) {
        bookingService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/allocations")
    public ResponseEntity<AllocationResult> previewAllocation(@Valid @RequestBody AllocationRequest request) {
        return ResponseEntity.ok(bookingService.allocateBookingQuantity(request));
    }
}
