package com.flagship.equipment_booking.store;

import com.flagship.equipment_booking.exception.ResourceNotFoundException;
import com.flagship.equipment_booking.observability.ActorContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Record store backed by a single PostgreSQL table.
 *
 * Every call runs in its own transaction, which mirrors the contract of the
 * remote store: single-record writes are atomic, nothing larger is.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaRecordStoreClient implements RecordStoreClient {

    private final RecordRepository recordRepository;

    @Value("${inventory.actor.default-id:system}")
    private String defaultActorId;

    @Value("${inventory.actor.default-name:System}")
    private String defaultActorName;

    @Override
    @Transactional(readOnly = true)
    public List<StoredRecord> listRecords(String category) {
        return recordRepository.findByCategoryOrderByIdAsc(category)
            .stream()
            .map(RecordEntity::toStoredRecord)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredRecord> getRecord(String category, String id) {
        return parseId(id)
            .flatMap(recordId -> recordRepository.findByIdAndCategory(recordId, category))
            .map(RecordEntity::toStoredRecord);
    }

    @Override
    @Transactional
    public StoredRecord createRecord(String category, String payload) {
        RecordEntity saved = recordRepository.saveAndFlush(RecordEntity.create(category, payload));
        log.debug("Created record {} in category {}", saved.getId(), category);
        return saved.toStoredRecord();
    }

    @Override
    @Transactional
    public StoredRecord updateRecord(String category, String id, String payload) {
        RecordEntity existing = parseId(id)
            .flatMap(recordId -> recordRepository.findByIdAndCategory(recordId, category))
            .orElseThrow(() -> new ResourceNotFoundException(category, id));

        existing.replacePayload(payload);
        RecordEntity updated = recordRepository.saveAndFlush(existing);
        log.debug("Updated record {} in category {}", id, category);
        return updated.toStoredRecord();
    }

    @Override
    @Transactional
    public void deleteRecord(String category, String id) {
        parseId(id)
            .flatMap(recordId -> recordRepository.findByIdAndCategory(recordId, category))
            .ifPresent(entity -> {
                recordRepository.delete(entity);
                log.debug("Deleted record {} in category {}", id, category);
            });
    }

    @Override
    public Actor getCurrentActor() {
        return ActorContext.current()
            .orElseGet(() -> Actor.of(defaultActorId, defaultActorName));
    }

    private Optional<Long> parseId(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(id));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
