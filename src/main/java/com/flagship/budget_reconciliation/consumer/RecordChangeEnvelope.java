package com.flagship.budget_reconciliation.consumer;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.UUID;

/**
 * Fields of a record-changed message the consumer routes on.
 */
public record RecordChangeEnvelope(UUID eventId, String eventType, String kind, String naturalKey,
                                   Integer projectNumber, JsonNode snapshot) {

    /**
     * @throws IllegalArgumentException if a required field is missing
     */
    static RecordChangeEnvelope from(JsonNode node) {
        String eventId = node.path("eventId").asText(null);
        String kind = node.path("kind").asText(null);
        String naturalKey = node.path("naturalKey").asText(null);
        JsonNode snapshot = node.path("snapshot");
        if (eventId == null || kind == null || naturalKey == null || !snapshot.isObject()) {
            throw new IllegalArgumentException("Record-changed message lacks eventId, kind, naturalKey or snapshot");
        }
        JsonNode project = node.path("projectNumber");
        return new RecordChangeEnvelope(
            UUID.fromString(eventId),
            node.path("eventType").asText("Unknown"),
            kind,
            naturalKey,
            project.isIntegralNumber() ? project.asInt() : null,
            snapshot);
    }
}
