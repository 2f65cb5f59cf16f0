package com.flagship.equipment_booking.asset;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class InUseBy {
    String personId;
    String personName;
    Instant since;
}
