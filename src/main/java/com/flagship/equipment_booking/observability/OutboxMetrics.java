package com.flagship.equipment_booking.observability;

import com.flagship.equipment_booking.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the change-history outbox.
 *
 * Gauges read cached values refreshed by {@link MetricsScheduler} so a
 * Prometheus scrape never hits the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong failedEventCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of unpublished change entries in the outbox")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished change entry in seconds")
                .register(meterRegistry);

        Gauge.builder("outbox.events.failed", failedEventCount, AtomicLong::get)
                .description("Number of change entries that exceeded max retry attempts")
                .tag("status", "failed")
                .register(meterRegistry);

        log.info("Outbox metrics registered with Micrometer");
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            long unpublished = outboxRepository.countUnpublished();
            backlogSize.set(unpublished);

            outboxRepository.findOldestUnpublishedCreatedAt()
                    .ifPresentOrElse(
                            oldest -> {
                                long ageSeconds = Duration.between(oldest, Instant.now()).getSeconds();
                                oldestEventAgeSeconds.set(Math.max(0, ageSeconds));
                            },
                            () -> oldestEventAgeSeconds.set(0)
                    );

            long failed = outboxRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries);
            failedEventCount.set(failed);

            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, failed={}",
                    unpublished, oldestEventAgeSeconds.get(), failed);

        } catch (Exception e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String entityType) {
        meterRegistry.counter("outbox.events.published",
                "entity_type", entityType,
                "status", "success"
        ).increment();
    }

    public void recordEventPublishFailed(String entityType) {
        meterRegistry.counter("outbox.events.published",
                "entity_type", entityType,
                "status", "failure"
        ).increment();
    }

    public void recordEventDeadLettered(String entityType) {
        meterRegistry.counter("outbox.events.dead_lettered",
                "entity_type", entityType
        ).increment();
    }
}
