package com.flagship.equipment_booking.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for booking and allocation operations.
 *
 * Metrics exposed:
 * - booking.created: bookings written, tagged by target type and initial status
 * - booking.rejected: create/transition attempts refused, tagged by reason
 * - booking.transition: lifecycle transitions, tagged by action
 * - booking.write_conflict: bookings cancelled by write-time conflict detection
 * - allocation.result: allocator outcomes (fulfilled / shortage)
 * - booking.latency: operation latency, tagged by operation
 */
@Component
public class BookingMetrics {

    private final MeterRegistry registry;

    private final Counter writeConflicts;
    private final Counter duplicateRequests;

    public BookingMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.writeConflicts = Counter.builder("booking.write_conflict")
                .description("Bookings cancelled because an earlier overlapping booking was found at write time")
                .register(registry);

        this.duplicateRequests = Counter.builder("booking.duplicate_requests")
                .description("Create requests answered from an earlier booking with the same request key")
                .register(registry);
    }

    public void recordBookingCreated(String targetType, String status) {
        registry.counter("booking.created",
                "target", sanitizeTag(targetType),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordBookingRejected(String reason) {
        registry.counter("booking.rejected",
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordTransition(String action) {
        registry.counter("booking.transition",
                "action", sanitizeTag(action)
        ).increment();
    }

    public void recordAllocation(String status) {
        registry.counter("allocation.result",
                "status", sanitizeTag(status)
        ).increment();
    }

    public void incrementWriteConflicts() {
        writeConflicts.increment();
    }

    public void incrementDuplicateRequests() {
        duplicateRequests.increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("booking.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
