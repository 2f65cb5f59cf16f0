package com.flagship.equipment_booking.health;

import com.flagship.equipment_booking.store.RecordRepository;
import com.flagship.equipment_booking.store.codec.RecordKind;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness/readiness endpoint for the record store.
 * Reports how many records each entity kind holds; a store that cannot be
 * counted is reported DOWN with 503. Unlike the Actuator health endpoint,
 * this does not require authorization.
 */
@RestController
@Slf4j
public class HealthController {

    private final RecordRepository recordRepository;
    private final Clock clock;

    public HealthController(RecordRepository recordRepository, Clock clock) {
        this.recordRepository = recordRepository;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant().toString());

        Map<String, Object> recordStore = new LinkedHashMap<>();
        response.put("recordStore", recordStore);

        try {
            Map<String, Long> records = new LinkedHashMap<>();
            for (RecordKind kind : RecordKind.values()) {
                records.put(kind.tag(), recordRepository.countByCategory(kind.category()));
            }
            recordStore.put("status", "UP");
            recordStore.put("records", records);
        } catch (RuntimeException e) {
            log.warn("Record store health check failed: {}", e.getMessage());
            recordStore.put("status", "DOWN");
            recordStore.put("error", e.getMessage());
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }
}
