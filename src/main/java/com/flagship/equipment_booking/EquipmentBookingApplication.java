package com.flagship.equipment_booking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class EquipmentBookingApplication {

    public static void main(String[] args) {
        SpringApplication.run(EquipmentBookingApplication.class, args);
    }
}
