package com.flagship.budget_reconciliation.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a consumer group has handled an event, so a redelivery is not
 * handled twice.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String kind;
    String naturalKey;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        /** Not handled on purpose, e.g. the project's batch was running. */
        SKIPPED,
        /** Handling failed; the event is not retried. */
        FAILED
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String kind,
                                         String naturalKey, String consumerGroup) {
        return new ProcessedEvent(eventId, eventType, kind, naturalKey, consumerGroup,
            Instant.now(), ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, String kind,
                                         String naturalKey, String consumerGroup, String reason) {
        return new ProcessedEvent(eventId, eventType, kind, naturalKey, consumerGroup,
            Instant.now(), ProcessingResult.SKIPPED, reason);
    }

    public static ProcessedEvent failed(UUID eventId, String eventType, String kind,
                                        String naturalKey, String consumerGroup, String errorMessage) {
        return new ProcessedEvent(eventId, eventType, kind, naturalKey, consumerGroup,
            Instant.now(), ProcessingResult.FAILED, errorMessage);
    }
}
