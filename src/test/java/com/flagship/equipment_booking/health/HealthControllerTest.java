package com.flagship.equipment_booking.health;

import com.flagship.equipment_booking.store.RecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.ResponseEntity;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthControllerTest {

    private RecordRepository recordRepository;
    private HealthController controller;

    @BeforeEach
    void setUp() {
        recordRepository = mock(RecordRepository.class);
        Clock clock = Clock.fixed(Instant.parse("2025-10-20T08:00:00Z"), ZoneOffset.UTC);
        controller = new HealthController(recordRepository, clock);
    }

    @Test
    @DisplayName("Health should count records per entity kind")
    @SuppressWarnings("unchecked")
    void testHealth_CountsRecords() {
        when(recordRepository.countByCategory("__assets__")).thenReturn(12L);
        when(recordRepository.countByCategory("__bookings__")).thenReturn(30L);
        when(recordRepository.countByCategory("__kits__")).thenReturn(2L);
        when(recordRepository.countByCategory("__asset_groups__")).thenReturn(3L);

        ResponseEntity<Map<String, Object>> response = controller.health();

        assertEquals(200, response.getStatusCode().value());
        assertEquals("UP", response.getBody().get("status"));
        assertEquals("2025-10-20T08:00:00Z", response.getBody().get("timestamp"));

        Map<String, Object> recordStore = (Map<String, Object>) response.getBody().get("recordStore");
        Map<String, Long> records = (Map<String, Long>) recordStore.get("records");
        assertEquals("UP", recordStore.get("status"));
        assertEquals(12L, records.get("asset"));
        assertEquals(30L, records.get("booking"));
        assertEquals(2L, records.get("kit"));
        assertEquals(3L, records.get("asset-group"));
    }

    @Test
    @DisplayName("Unreachable record store should answer 503")
    @SuppressWarnings("unchecked")
    void testHealth_StoreDown() {
        when(recordRepository.countByCategory(anyString()))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        ResponseEntity<Map<String, Object>> response = controller.health();

        assertEquals(503, response.getStatusCode().value());
        assertEquals("DOWN", response.getBody().get("status"));
        Map<String, Object> recordStore = (Map<String, Object>) response.getBody().get("recordStore");
        assertEquals("DOWN", recordStore.get("status"));
        assertEquals("connection refused", recordStore.get("error"));
    }
}
