package com.flagship.equipment_booking.outbox;

import com.flagship.equipment_booking.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Background publisher that moves change-history entries from the outbox
 * to the inventory-changes topic.
 *
 * - Uses SELECT FOR UPDATE SKIP LOCKED so several instances can poll
 * - Sends synchronously, keyed by entity id, to keep per-entity order
 * - Failed sends increment the retry count; entries past max retries are
 *   left in place as dead letters
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.inventory-changes:inventory-changes}")
    private String inventoryChangesTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize);

            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished change entries to process", events.size());

            for (OutboxEvent event : events) {
                publishEvent(event);
            }

        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        if (event.getRetryCount() >= maxRetries) {
            log.warn("Event {} has exceeded max retries ({}), moving to dead letter. entityType={}, entityId={}",
                    event.getId(), maxRetries, event.getEntityType(), event.getEntityId());
            outboxMetrics.recordEventDeadLettered(event.getEntityType());
            return;
        }

        try {
            CompletableFuture<SendResult<String, String>> future =
                    kafkaTemplate.send(inventoryChangesTopic, event.getEntityId(), event.getPayload());

            SendResult<String, String> result = future.get();

            log.debug("Published change entry: eventId={}, topic={}, partition={}, offset={}, action={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getAction());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEntityType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while publishing event {}", event.getId());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, entityType={}, error={}",
                    event.getId(), event.getEntityType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEntityType());
        }
    }
}
