package com.flagship.equipment_booking.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes change-history entries to the outbox and serves the publisher.
 *
 * The record store has no multi-record transaction, so an entry is written
 * in its own transaction right after the store write it describes. Kafka is
 * never called from here; that is the job of {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Saves an entry to the outbox.
     *
     * @param entityType type of the changed entity (e.g., "booking")
     * @param entityId id of the changed entity
     * @param action what happened (e.g., "created", "cancelled")
     * @param payload entry payload (serialized to JSON)
     * @return the saved event
     */
    @Transactional(propagation = Propagation.REQUIRED)
    public OutboxEvent saveEvent(String entityType, String entityId,
                                 String action, Object payload) {
        String jsonPayload = serializePayload(payload);

        OutboxEvent event = OutboxEvent.create(entityType, entityId, action, jsonPayload);
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Saved outbox event: entityType={}, entityId={}, action={}",
                entityType, entityId, action);

        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit) {
        return repository.findUnpublishedEventsForUpdate(limit)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    /**
     * Change history of one entity (for auditing).
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getHistory(String entityType, String entityId) {
        return repository.findByEntityTypeAndEntityIdOrderByCreatedAtAsc(entityType, entityId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize change history payload", e);
        }
    }
}
