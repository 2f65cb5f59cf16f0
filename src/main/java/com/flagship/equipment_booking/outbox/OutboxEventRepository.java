package com.flagship.equipment_booking.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * Finds unpublished entries oldest first, skipping rows another
     * publisher instance has locked.
     */
    @Query(value = """
        SELECT * FROM outbox_events
        WHERE published_at IS NULL
        ORDER BY created_at ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEventEntity> findUnpublishedEventsForUpdate(@Param("limit") int limit);

    /**
     * History of one entity, oldest first.
     */
    List<OutboxEventEntity> findByEntityTypeAndEntityIdOrderByCreatedAtAsc(String entityType, String entityId);

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    long countUnpublished();

    long countByPublishedAtIsNullAndRetryCountGreaterThanEqual(int retryCount);

    @Query("""
        SELECT MIN(e.createdAt) FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL
        """)
    Optional<Instant> findOldestUnpublishedCreatedAt();
}
