package com.flagship.equipment_booking.history;

import com.flagship.equipment_booking.observability.CorrelationContext;
import com.flagship.equipment_booking.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes change history to the transactional outbox, from where
 * {@link com.flagship.equipment_booking.outbox.OutboxPublisher} sends it to Kafka.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxChangeHistoryRecorder implements ChangeHistoryRecorder {

    private final OutboxService outboxService;

    @Override
    public void record(ChangeEntry entry) {
        ChangeEntry correlated = CorrelationContext.hasCorrelationId()
            ? entry.toBuilder().correlationId(CorrelationContext.getCorrelationId()).build()
            : entry;

        try {
            outboxService.saveEvent(entry.getEntityType(), entry.getEntityId(), entry.getAction(), correlated);
        } catch (Exception e) {
            log.warn("Failed to record {} history for {} {}: {}",
                entry.getAction(), entry.getEntityType(), entry.getEntityId(), e.getMessage());
        }
    }
}
