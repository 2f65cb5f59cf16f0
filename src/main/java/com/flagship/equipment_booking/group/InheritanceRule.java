package com.flagship.equipment_booking.group;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * How one field behaves for the members of a group.
 */
@Value
@Builder
@Jacksonized
public class InheritanceRule {
    boolean inherited;
    boolean overridable;

    public static InheritanceRule of(boolean inherited, boolean overridable) {
        return new InheritanceRule(inherited, overridable);
    }
}
