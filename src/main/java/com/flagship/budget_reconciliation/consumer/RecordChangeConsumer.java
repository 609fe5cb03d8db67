package com.flagship.budget_reconciliation.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.budget_reconciliation.batch.BatchLogService;
import com.flagship.budget_reconciliation.observability.BudgetMetrics;
import com.flagship.budget_reconciliation.observability.CorrelationContext;
import com.flagship.budget_reconciliation.sync.DownstreamSyncException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Consumes record-changed notifications from both budget topics.
 *
 * - manual acknowledgment: the offset is committed only after handling
 * - each event is handled once per consumer group (processed_events)
 * - events of a project whose batch is STARTED are recorded as skipped; the
 *   batch re-evaluates the project when it completes
 * - a downstream sync failure after retries is recorded and acknowledged;
 *   any other failure is not acknowledged, so the message is redelivered
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RecordChangeConsumer {

    static final String CONSUMER_GROUP = "budget-record-consumer";

    private final IdempotentEventProcessor eventProcessor;
    private final RecordChangeHandler handler;
    private final BatchLogService batchLogService;
    private final BudgetMetrics metrics;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = {"${kafka.topic.detail-items:budget.detail-items}", "${kafka.topic.records:budget.records}"},
        groupId = "${spring.kafka.consumer.group-id:budget-reconciliation-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
            record.topic(), record.partition(), record.offset(), record.key());

        RecordChangeEnvelope envelope;
        try {
            envelope = RecordChangeEnvelope.from(objectMapper.readTree(record.value()));
        } catch (Exception e) {
            log.warn("Unreadable message at {}-{}@{}, acknowledging to skip: {}",
                record.topic(), record.partition(), record.offset(), e.getMessage());
            ack.acknowledge();
            return;
        }

        boolean owner = CorrelationContext.begin(envelope.projectNumber());
        try {
            boolean processed = route(envelope);
            metrics.recordEventProcessed(envelope.kind(), processed);
            ack.acknowledge();
            if (processed) {
                log.info("Processed event: type={}, kind={}, key={}, eventId={}",
                    envelope.eventType(), envelope.kind(), envelope.naturalKey(), envelope.eventId());
            }
        } catch (DownstreamSyncException e) {
            log.error("Event {} recorded as failed after downstream retries: {}", envelope.eventId(), e.getMessage());
            ack.acknowledge();
        } catch (RuntimeException e) {
            log.error("Error processing event {} at offset {}: {}", envelope.eventId(), record.offset(), e.getMessage(), e);
            throw e;
        } finally {
            CorrelationContext.end(owner);
        }
    }

    boolean route(RecordChangeEnvelope envelope) {
        if (envelope.projectNumber() != null && batchLogService.isInProgress(envelope.projectNumber())) {
            log.info("Batch in progress for project {}; skipping {} {}",
                envelope.projectNumber(), envelope.kind(), envelope.naturalKey());
            eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(), envelope.kind(),
                envelope.naturalKey(), CONSUMER_GROUP, "Batch in progress");
            return false;
        }
        return eventProcessor.processEvent(envelope.eventId(), envelope.eventType(), envelope.kind(),
            envelope.naturalKey(), CONSUMER_GROUP, () -> handler.onRecordChanged(envelope));
    }
}
