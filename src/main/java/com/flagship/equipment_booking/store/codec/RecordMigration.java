package com.flagship.equipment_booking.store.codec;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Upgrades the data of one record from schema version n to n + 1.
 * Implementations may mutate and return the node they are given.
 */
@FunctionalInterface
public interface RecordMigration {

    ObjectNode migrate(ObjectNode data);
}
