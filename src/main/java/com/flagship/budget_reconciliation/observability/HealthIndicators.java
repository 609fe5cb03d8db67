package com.flagship.budget_reconciliation.observability;

import com.flagship.budget_reconciliation.batch.BatchLogService;
import com.flagship.budget_reconciliation.outbox.OutboxEventRepository;
import com.flagship.budget_reconciliation.persistence.StoredRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Health indicators contributed to the actuator health endpoint.
 */
public class HealthIndicators {

    /**
     * Unhealthy when too many record-changed events wait to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

    /**
     * Reports batches left at STARTED, typically by a crashed worker. Their
     * projects receive no reconciliation until someone resets the BatchLog.
     */
    @Component("batchHealth")
    public static class StaleBatchHealthIndicator implements HealthIndicator {

        private final BatchLogService batchLogService;
        private final Duration staleAfter;

        public StaleBatchHealthIndicator(BatchLogService batchLogService,
                                         @Value("${batch.stale-after-minutes:60}") long staleAfterMinutes) {
            this.batchLogService = batchLogService;
            this.staleAfter = Duration.ofMinutes(staleAfterMinutes);
        }

        @Override
        public Health health() {
            try {
                List<StoredRecord> stale = batchLogService.findStale(staleAfter);
                Health.Builder builder = stale.isEmpty() ? Health.up() : Health.status("WARNING");
                return builder
                        .withDetail("staleAfterMinutes", staleAfter.toMinutes())
                        .withDetail("staleProjects", stale.stream()
                                .map(batch -> batch.getInteger("project_number"))
                                .toList())
                        .build();
            } catch (Exception e) {
                return Health.down().withDetail("error", e.getMessage()).build();
            }
        }
    }

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
                            .withDetail("error", "No Kafka producer connections established")
                            .build();
                }
                return Health.up().withDetail("metricsCount", metrics.size()).build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
