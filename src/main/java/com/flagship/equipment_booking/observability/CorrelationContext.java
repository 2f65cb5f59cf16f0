package com.flagship.equipment_booking.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local context for correlation ID propagation.
 *
 * The correlation ID flows through:
 * - HTTP requests (from header or generated)
 * - Record store calls (in logs)
 * - Change history events published to Kafka
 * - All log statements (via MDC)
 *
 * Booking and asset ids are added to the MDC only for the work on that
 * entity, through the closeable scopes below.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String BOOKING_ID_MDC_KEY = "bookingId";
    public static final String ASSET_ID_MDC_KEY = "assetId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    /**
     * Sets the correlation ID for the current thread, or a fresh one when blank.
     */
    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    /**
     * Clears the correlation ID from the current thread.
     * Called by the request filter once the response is written.
     */
    public static void clear() {
        correlationId.remove();
    }

    /**
     * Generates a new correlation ID.
     * Uses a shorter format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }

    /**
     * Tags log lines with {@code assetId} until the scope is closed.
     */
    public static MDC.MDCCloseable assetScope(String assetId) {
        return MDC.putCloseable(ASSET_ID_MDC_KEY, assetId);
    }

    public static MDC.MDCCloseable bookingScope(String bookingId) {
        return MDC.putCloseable(BOOKING_ID_MDC_KEY, bookingId);
    }
}
