package com.flagship.equipment_booking.booking;

import com.flagship.equipment_booking.inventory.BookingFilter;
import com.flagship.equipment_booking.inventory.InventoryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.Optional;

/**
 * Maps caller-supplied request keys to the booking they created.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the record store, where every booking keeps its requestKey
 * 3. Re-cache store hits in Redis
 *
 * The record store is the source of truth; Redis is only a shortcut.
 */
@Service
@Slf4j
public class BookingIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "booking-request:";

    private final InventoryStore inventoryStore;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final Duration ttl;

    public BookingIdempotencyService(InventoryStore inventoryStore,
                                     Optional<StringRedisTemplate> redisTemplate,
                                     @Value("${booking.idempotency.ttl:7d}") Duration ttl) {
        this.inventoryStore = inventoryStore;
        this.redisTemplate = redisTemplate;
        this.ttl = ttl;
    }

    /**
     * Finds the booking an earlier call with the same request key created.
     *
     * Bookings that lost a write-time conflict are skipped: that call was
     * answered with an availability error, so a retry must not report it as
     * created.
     */
    public Optional<Booking> findExisting(String requestKey) {
        if (requestKey == null || requestKey.isBlank()) {
            throw new IllegalArgumentException("Request key cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String bookingId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + requestKey);
                if (bookingId != null) {
                    Optional<Booking> cached = inventoryStore.findBooking(bookingId)
                        .filter(booking -> !booking.isWriteConflictLoser());
                    if (cached.isPresent()) {
                        log.debug("Request key found in Redis: {}", requestKey);
                        return cached;
                    }
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for request key: {}. Falling back to record store. Error: {}",
                        requestKey, e.getMessage());
            }
        }

        Optional<Booking> stored = inventoryStore.getBookings(BookingFilter.builder().requestKey(requestKey).build())
            .stream()
            .filter(booking -> !booking.isWriteConflictLoser())
            .min(Comparator.comparing(Booking::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder())));

        stored.ifPresent(booking -> {
            log.debug("Request key found in record store: {}", requestKey);
            cache(requestKey, booking.getId());
        });
        return stored;
    }

    /**
     * Caches the mapping in Redis. Best effort; the booking record already
     * carries the key.
     */
    public void remember(String requestKey, String bookingId) {
        if (requestKey == null || requestKey.isBlank()) {
            throw new IllegalArgumentException("Request key cannot be null or blank");
        }
        if (bookingId == null) {
            throw new IllegalArgumentException("Booking ID cannot be null");
        }
        cache(requestKey, bookingId);
    }

    private void cache(String requestKey, String bookingId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + requestKey, bookingId, ttl);
            log.debug("Stored request key in Redis: {} -> {}", requestKey, bookingId);
        } catch (Exception e) {
            log.warn("Failed to store request key in Redis: {}. Error: {}", requestKey, e.getMessage());
        }
    }
}
