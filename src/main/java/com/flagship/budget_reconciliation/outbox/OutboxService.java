package com.flagship.budget_reconciliation.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.budget_reconciliation.persistence.StoredRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes record-changed notifications to the outbox.
 *
 * Transactional outbox:
 * - {@link #recordChanged} joins the caller's transaction (MANDATORY), so a
 *   notification exists exactly when the record change commits
 * - publishing to Kafka happens later in {@link OutboxPublisher}
 * - publisher bookkeeping (published, failed) runs in its own transactions
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Queues a notification carrying the full snapshot of {@code record}.
     *
     * @param eventType {@link RecordChangedEvent#CREATED} or {@link RecordChangedEvent#UPDATED}
     * @param record the record as it now stands
     * @return the queued outbox event
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent recordChanged(String eventType, StoredRecord record) {
        RecordChangedEvent payload = RecordChangedEvent.of(eventType, record);
        OutboxEvent event = OutboxEvent.create(
            payload.getKind(), payload.getNaturalKey(), payload.getProjectNumber(), eventType,
            serializePayload(payload));

        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Queued outbox event: type={}, kind={}, key={}",
            eventType, payload.getKind(), payload.getNaturalKey());
        return saved.toDomain();
    }

    /**
     * Locks and returns the next batch of publishable events.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishable(int limit, int maxRetries) {
        return repository.findPublishableForUpdate(limit, maxRetries)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                eventId, entity.getRetryCount(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForRecord(String kind, String naturalKey) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(kind, naturalKey)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    @Transactional
    public int purgePublishedBefore(Instant cutoff) {
        return repository.deletePublishedBefore(cutoff);
    }

    private String serializePayload(RecordChangedEvent payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize record-changed payload", e);
        }
    }
}
