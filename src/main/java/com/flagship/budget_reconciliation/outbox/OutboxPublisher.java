package com.flagship.budget_reconciliation.outbox;

import com.flagship.budget_reconciliation.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Polls the outbox and publishes record-changed notifications to Kafka.
 *
 * - SELECT ... FOR UPDATE SKIP LOCKED lets several instances publish concurrently
 * - sends synchronously, in sequence order, keyed by natural key so one record's
 *   changes stay ordered on a partition
 * - DetailItem events go to the detail-items topic, everything else to the records topic
 * - a failed send increments the retry count; events at max-retries are dead letters
 *   and are no longer picked up
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.detail-items:budget.detail-items}")
    private String detailItemsTopic;

    @Value("${kafka.topic.records:budget.records}")
    private String recordsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Value("${outbox.retention-days:7}")
    private int retentionDays;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPublishable(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }
            log.debug("Found {} outbox events to publish", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    @Scheduled(cron = "${outbox.retention-cron:0 30 3 * * *}")
    public void purgePublished() {
        Instant cutoff = Instant.now().minus(Duration.ofDays(retentionDays));
        int removed = outboxService.purgePublishedBefore(cutoff);
        if (removed > 0) {
            log.info("Purged {} published outbox events older than {}", removed, cutoff);
        }
    }

    private void publishEvent(OutboxEvent event) {
        String topic = topicFor(event);
        try {
            SendResult<String, String> result = kafkaTemplate
                .send(topic, event.getAggregateId(), event.getPayload())
                .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, kind={}",
                event.getId(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(),
                event.getAggregateType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getAggregateType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "interrupted");
            outboxMetrics.recordEventPublishFailed(event.getAggregateType());
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.error("Failed to publish event: eventId={}, kind={}, key={}, error={}",
                event.getId(), event.getAggregateType(), event.getAggregateId(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getAggregateType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached max retries ({}), now a dead letter. kind={}, key={}",
                    event.getId(), maxRetries, event.getAggregateType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getAggregateType());
            }
        }
    }

    String topicFor(OutboxEvent event) {
        return "DetailItem".equals(event.getAggregateType()) ? detailItemsTopic : recordsTopic;
    }

    /**
     * Runs one polling pass immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
