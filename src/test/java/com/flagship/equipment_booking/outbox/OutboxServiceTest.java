package com.flagship.equipment_booking.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.equipment_booking.asset.Asset;
import com.flagship.equipment_booking.asset.AssetService;
import com.flagship.equipment_booking.booking.Booking;
import com.flagship.equipment_booking.booking.BookingCreate;
import com.flagship.equipment_booking.booking.BookingService;
import com.flagship.equipment_booking.booking.BookingTarget;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox persistence tests against PostgreSQL.
 *
 * These tests verify:
 * - Entries are saved unpublished with their payload as JSON
 * - Publishing and failure bookkeeping update the stored row
 * - Booking operations leave their change history in the outbox
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_inventory")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Disable outbox publisher during tests
        registry.add("outbox.publisher.enabled", () -> "false");
        // Disable Kafka for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private AssetService assetService;

    @Autowired
    private BookingService bookingService;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Outbox event should be created with correct data")
    void testSaveEvent_CreatesCorrectEvent() throws Exception {
        printTestHeader("Save Event - Creates Correct Event");

        String entityId = "42";
        OutboxEvent event = outboxService.saveEvent("asset", entityId, "updated",
            Map.of("field", "location", "newValue", "Hall B"));

        System.out.println("Event ID: " + event.getId());
        System.out.println("Payload: " + event.getPayload());

        assertNotNull(event.getId(), "Event ID should be generated");
        assertEquals("asset", event.getEntityType());
        assertEquals(entityId, event.getEntityId());
        assertEquals("updated", event.getAction());
        assertFalse(event.isPublished(), "Event should not be published yet");
        assertEquals(0, event.getRetryCount());

        JsonNode payload = objectMapper.readTree(event.getPayload());
        assertEquals("Hall B", payload.get("newValue").asText());

        printSuccess("Outbox event created with correct data");
    }

    @Test
    @DisplayName("Published and failed events should update their bookkeeping")
    void testMarkPublishedAndFailed() {
        printTestHeader("Mark Published / Failed");

        OutboxEvent first = outboxService.saveEvent("kit", "7", "created", Map.of("name", "Podcast kit"));
        OutboxEvent second = outboxService.saveEvent("kit", "8", "created", Map.of("name", "Lighting kit"));

        assertEquals(2, outboxService.findUnpublishedEvents(10).size());

        outboxService.markPublished(first.getId());
        outboxService.markFailed(second.getId(), "broker unavailable");

        List<OutboxEvent> unpublished = outboxService.findUnpublishedEvents(10);
        System.out.println("Unpublished after marking: " + unpublished.size());

        assertEquals(1, unpublished.size());
        assertEquals(second.getId(), unpublished.get(0).getId());
        assertEquals(1, unpublished.get(0).getRetryCount());
        assertEquals("broker unavailable", unpublished.get(0).getLastError());
        assertEquals(1, outboxService.countUnpublished());

        printSuccess("Published event dropped from the backlog, failed event kept with retry count");
    }

    @Test
    @DisplayName("Booking creation and cancellation should write change history")
    void testBookingHistory_IsWritten() throws Exception {
        printTestHeader("Booking History in Outbox");

        Asset asset = assetService.createAsset(Asset.builder()
            .assetNumber("MIC-" + UUID.randomUUID().toString().substring(0, 8))
            .name("Shotgun microphone")
            .build());

        Instant start = Instant.now().plus(3, ChronoUnit.DAYS).truncatedTo(ChronoUnit.HOURS);
        Booking booking = bookingService.create(BookingCreate.builder()
            .target(BookingTarget.asset(asset.getId()))
            .startDate(start)
            .endDate(start.plus(4, ChronoUnit.HOURS))
            .purpose("Interview")
            .build());
        bookingService.cancel(booking.getId(), "Interview moved");

        List<OutboxEvent> history = outboxService.getHistory("booking", booking.getId());
        history.forEach(event -> System.out.println(event.getAction() + ": " + event.getPayload()));

        assertEquals(List.of("created", "cancelled"),
            history.stream().map(OutboxEvent::getAction).toList());

        JsonNode cancelled = objectMapper.readTree(history.get(1).getPayload());
        assertEquals(booking.getId(), cancelled.get("entityId").asText());

        printSuccess("Booking lifecycle recorded in order");
    }
}
