package com.flagship.budget_reconciliation.outbox;

import com.flagship.budget_reconciliation.persistence.StoredRecord;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Notification that a record was created or changed.
 *
 * Carries the full current snapshot rather than a diff, so a downstream mirror
 * can apply it without reading back from this service.
 */
@Value
public class RecordChangedEvent {

    public static final String CREATED = "RecordCreated";
    public static final String UPDATED = "RecordUpdated";

    UUID eventId;
    String eventType;
    String kind;
    String naturalKey;
    Integer projectNumber;
    long recordId;
    Map<String, Object> key;
    Map<String, Object> snapshot;
    Instant occurredAt;

    public static RecordChangedEvent of(String eventType, StoredRecord record) {
        Object project = record.get("project_number");
        return new RecordChangedEvent(
            UUID.randomUUID(),
            eventType,
            record.getKind().aggregateType(),
            record.naturalKeyString(),
            project instanceof Integer p ? p : null,
            record.getId(),
            record.naturalKey(),
            record.getFields(),
            Instant.now()
        );
    }
}
