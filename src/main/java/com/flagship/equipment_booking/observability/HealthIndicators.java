package com.flagship.equipment_booking.observability;

import com.flagship.equipment_booking.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the booking service.
 */
public class HealthIndicators {

    /**
     * Unhealthy when change history piles up in the outbox.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();
                long deadLetters = outboxRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries);

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("deadLetters", deadLetters)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis only backs the request-key fast path, so an outage degrades
     * rather than fails the service.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Request keys are resolved from the record store without Redis";

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            var connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "No connection factory configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }

            try (RedisConnection connection = connectionFactory.getConnection()) {
                String result = connection.ping();

                if ("PONG".equals(result)) {
                    return Health.up()
                            .withDetail("response", result)
                            .build();
                }
                return Health.down()
                        .withDetail("response", result != null ? result : "null")
                        .build();

            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }

    /**
     * Kafka connectivity for the change-history publisher.
     */
    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
