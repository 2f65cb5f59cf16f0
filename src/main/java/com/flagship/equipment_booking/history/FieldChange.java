package com.flagship.equipment_booking.history;

import lombok.Value;

@Value(staticConstructor = "of")
public class FieldChange {
    String field;
    String oldValue;
    String newValue;
}
