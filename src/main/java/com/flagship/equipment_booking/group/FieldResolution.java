package com.flagship.equipment_booking.group;

import com.flagship.equipment_booking.asset.FieldSource;
import lombok.Value;

/**
 * Effective value of one field of an asset, and where it came from.
 */
@Value(staticConstructor = "of")
public class FieldResolution {
    Object value;
    FieldSource source;
}
