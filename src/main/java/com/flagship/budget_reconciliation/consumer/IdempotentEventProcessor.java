package com.flagship.budget_reconciliation.consumer;

import com.flagship.budget_reconciliation.sync.DownstreamSyncException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Runs an event handler at most once per event and consumer group, even when
 * Kafka redelivers after a crash or a rebalance.
 *
 * A downstream sync failure is recorded as FAILED and committed together with
 * the handler's database work; the event is then not redelivered. Any other
 * failure rolls everything back and propagates, so the message is redelivered.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the event had already been processed
     * @throws DownstreamSyncException after recording the event as FAILED
     */
    @Transactional(noRollbackFor = DownstreamSyncException.class)
    public boolean processEvent(UUID eventId, String eventType, String kind, String naturalKey,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        try {
            handler.run();
        } catch (DownstreamSyncException e) {
            recordProcessed(ProcessedEvent.failed(eventId, eventType, kind, naturalKey, consumerGroup, e.getMessage()));
            log.error("Event {} ({} {}) failed downstream sync: {}", eventId, kind, naturalKey, e.getMessage());
            throw e;
        }

        recordProcessed(ProcessedEvent.success(eventId, eventType, kind, naturalKey, consumerGroup));
        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    /**
     * Records an event as deliberately not handled, so it is not processed later.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType, String kind, String naturalKey,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        recordProcessed(ProcessedEvent.skipped(eventId, eventType, kind, naturalKey, consumerGroup, reason));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    private void recordProcessed(ProcessedEvent event) {
        repository.save(ProcessedEventEntity.fromDomain(event));
    }
}
