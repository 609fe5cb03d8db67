package com.flagship.budget_reconciliation.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Outbox row: a record-changed notification waiting to be published to Kafka.
 *
 * Written in the same transaction as the record change it describes, published
 * later by {@link OutboxPublisher}. The aggregate id is the record's natural key
 * string, which is also the Kafka message key. Events of a project whose batch
 * is running are held back until the batch ends.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // record kind, e.g. "DetailItem"
    String aggregateId;        // natural key, e.g. "2416:12:3:1"
    Integer projectNumber;     // null for kinds without a project
    String eventType;          // RecordCreated or RecordUpdated
    String payload;            // JSON RecordChangedEvent
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String aggregateId, Integer projectNumber,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            projectNumber,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLetter(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
