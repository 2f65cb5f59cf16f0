package com.flagship.equipment_booking.history;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.equipment_booking.store.Actor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One entry of an entity's change history.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChangeEntry {
    String entityType;
    String entityId;
    String entityName;
    String action;
    @Builder.Default
    List<FieldChange> changes = List.of();
    String note;
    String changedById;
    String changedByName;
    Instant changedAt;
    String correlationId;

    public static ChangeEntry of(String entityType, String entityId, String action, Actor actor, Instant at) {
        return ChangeEntry.builder()
            .entityType(entityType)
            .entityId(entityId)
            .action(action)
            .changedById(actor.getId())
            .changedByName(actor.getName())
            .changedAt(at)
            .build();
    }
}
