package com.flagship.equipment_booking.store;

import lombok.Value;

/**
 * The person (or system) on whose behalf the store is written to.
 * Used for audit stamps on bookings and change history.
 */
@Value(staticConstructor = "of")
public class Actor {
    String id;
    String name;
}
