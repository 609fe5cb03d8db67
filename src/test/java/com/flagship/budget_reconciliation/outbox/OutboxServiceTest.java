package com.flagship.budget_reconciliation.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.budget_reconciliation.IntegrationTestSupport;
import com.flagship.budget_reconciliation.batch.BatchLogService;
import com.flagship.budget_reconciliation.persistence.RecordKind;
import com.flagship.budget_reconciliation.persistence.StoredRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.IllegalTransactionStateException;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Transactional outbox for record-changed notifications
 *
 * These tests verify that:
 * - Notifications are written only inside the record change's transaction
 * - Payloads carry the full record snapshot
 * - Events of a project whose batch is running are held back
 * - Failed events are retried up to the limit and then dead-lettered
 * - Published events can be purged
 */
class OutboxServiceTest extends IntegrationTestSupport {

    private static final int MAX_RETRIES = 3;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private BatchLogService batchLogService;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        cleanDatabase();
    }

    @Test
    @DisplayName("Payload carries the kind, natural key and full snapshot")
    void payloadCarriesSnapshot() throws Exception {
        printTestHeader("Record-changed payload");

        createDetailItem(2416, 12, 3, 1, "CC", "SUBMITTED", "42.50", null);

        OutboxEvent event = outboxService.getEventsForRecord("DetailItem", "2416:12:3:1").get(0);
        JsonNode payload = objectMapper.readTree(event.getPayload());

        System.out.println("Payload: " + event.getPayload());

        assertEquals("DetailItem", event.getAggregateType());
        assertEquals(RecordChangedEvent.CREATED, payload.get("eventType").asText());
        assertEquals("2416:12:3:1", payload.get("naturalKey").asText());
        assertEquals(2416, payload.get("projectNumber").asInt());
        assertEquals("SUBMITTED", payload.get("snapshot").get("state").asText());
        assertEquals(42.5, payload.get("snapshot").get("sub_total").asDouble(), 0.0001);
        assertEquals(3, payload.get("key").get("detail_number").asInt());

        printSuccess("Snapshot serialized with " + payload.get("snapshot").size() + " fields");
    }

    @Test
    @DisplayName("Writing a notification outside a transaction is refused")
    void requiresTransaction() {
        StoredRecord record = store.create(RecordKind.CONTACT, Map.of("name", "Acme Grip")).orElseThrow();

        assertThrows(IllegalTransactionStateException.class,
            () -> outboxService.recordChanged(RecordChangedEvent.UPDATED, record));
    }

    @Test
    @DisplayName("Events of a project whose batch is running are held back until it completes")
    void heldBackDuringBatch() {
        printTestHeader("Hold back during batch");

        startBatch(2416);
        createDetailItem(2416, 12, 1, 1, "INV", "PENDING", "10.00", null);
        store.create(RecordKind.CONTACT, Map.of("name", "Acme Grip")).orElseThrow();

        List<OutboxEvent> during = outboxService.findPublishable(100, MAX_RETRIES);
        assertEquals(1, during.size(), "Only the project-less Contact event is publishable");
        assertEquals("Contact", during.get(0).getAggregateType());

        batchLogService.markCompleted(2416);

        List<OutboxEvent> after = outboxService.findPublishable(100, MAX_RETRIES);
        assertEquals(2, after.size());
        assertTrue(after.get(0).getSequenceNumber() < after.get(1).getSequenceNumber(), "Sequence order");

        printSuccess("DetailItem event released after the batch completed");
    }

    @Test
    @DisplayName("Failed events count retries and stop being picked up at the limit")
    void deadLetterAfterMaxRetries() {
        store.create(RecordKind.CONTACT, Map.of("name", "Acme Grip")).orElseThrow();
        OutboxEvent event = outboxService.getEventsForRecord("Contact", "Acme Grip").get(0);

        for (int i = 0; i < MAX_RETRIES; i++) {
            assertEquals(1, outboxService.findPublishable(100, MAX_RETRIES).size(), "attempt " + i);
            outboxService.markFailed(event.getId(), "broker unavailable");
        }

        OutboxEvent failed = outboxService.getEventsForRecord("Contact", "Acme Grip").get(0);
        assertEquals(MAX_RETRIES, failed.getRetryCount());
        assertEquals("broker unavailable", failed.getLastError());
        assertTrue(failed.isDeadLetter(MAX_RETRIES));
        assertTrue(outboxService.findPublishable(100, MAX_RETRIES).isEmpty());
    }

    @Test
    @DisplayName("Published events leave the backlog and can be purged")
    void publishAndPurge() {
        store.create(RecordKind.CONTACT, Map.of("name", "Acme Grip")).orElseThrow();
        OutboxEvent event = outboxService.getEventsForRecord("Contact", "Acme Grip").get(0);
        assertEquals(1, outboxService.countUnpublished());

        outboxService.markPublished(event.getId());

        assertEquals(0, outboxService.countUnpublished());
        assertTrue(outboxService.getEventsForRecord("Contact", "Acme Grip").get(0).isPublished());
        assertEquals(0, outboxService.purgePublishedBefore(Instant.now().minusSeconds(3600)));
        assertEquals(1, outboxService.purgePublishedBefore(Instant.now().plusSeconds(60)));
        assertTrue(outboxService.getEventsForRecord("Contact", "Acme Grip").isEmpty());
    }
}
