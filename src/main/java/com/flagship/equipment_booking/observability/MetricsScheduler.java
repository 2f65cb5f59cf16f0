package com.flagship.equipment_booking.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically refreshes gauges that need database queries.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }
}
