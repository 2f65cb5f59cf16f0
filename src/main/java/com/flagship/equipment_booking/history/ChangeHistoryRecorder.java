package com.flagship.equipment_booking.history;

/**
 * Sink for change-history entries.
 *
 * Recording is a secondary effect: implementations must not throw, so a
 * history failure never fails the operation that caused it.
 */
public interface ChangeHistoryRecorder {

    void record(ChangeEntry entry);
}
