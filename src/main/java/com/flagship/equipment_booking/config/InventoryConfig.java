package com.flagship.equipment_booking.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Time sources for the booking engine.
 *
 * The zone is used to turn single-day bookings (date + start/end time)
 * into instants.
 */
@Configuration
public class InventoryConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ZoneId bookingZone(@Value("${inventory.booking.zone:UTC}") String zone) {
        return ZoneId.of(zone);
    }
}
