package com.flagship.equipment_booking.availability;

import lombok.Value;

import java.time.Instant;

/**
 * A closed booking window. Boundaries are inclusive, so a window ending
 * exactly when another starts overlaps it.
 */
@Value(staticConstructor = "of")
public class TimeWindow {
    Instant start;
    Instant end;

    public boolean overlaps(TimeWindow other) {
        return !start.isAfter(other.end) && !end.isBefore(other.start);
    }

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return overlaps(TimeWindow.of(otherStart, otherEnd));
    }
}
