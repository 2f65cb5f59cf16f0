package com.flagship.equipment_booking.store;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

/**
 * JPA entity backing the generic record store.
 *
 * Key design principles:
 * - Ids are assigned by the database in insert order
 * - Category and created_at never change after insert
 * - The payload is stored as jsonb and never interpreted here
 */
@Entity
@Table(
    name = "records",
    indexes = {
        @Index(name = "idx_records_category", columnList = "category")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false, length = 100)
    private String category;

    @Column(nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "modified_at", nullable = false)
    private Instant modifiedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.modifiedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.modifiedAt = Instant.now();
    }

    static RecordEntity create(String category, String payload) {
        RecordEntity entity = new RecordEntity();
        entity.category = category;
        entity.payload = payload;
        return entity;
    }

    void replacePayload(String payload) {
        this.payload = payload;
    }

    StoredRecord toStoredRecord() {
        return new StoredRecord(String.valueOf(id), category, payload, createdAt, modifiedAt);
    }
}
