package com.flagship.budget_reconciliation.consumer;

import com.flagship.budget_reconciliation.IntegrationTestSupport;
import com.flagship.budget_reconciliation.persistence.RecordKind;
import com.flagship.budget_reconciliation.sync.DownstreamSyncException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Idempotent event processing
 *
 * These tests verify that:
 * - Events are processed exactly once per consumer group
 * - Duplicate and skipped events do not run the handler
 * - A downstream sync failure is recorded as FAILED and keeps the handler's work
 * - Any other failure rolls back the handler's work and leaves the event unprocessed
 */
class IdempotentEventProcessorTest extends IntegrationTestSupport {

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private ProcessedEventRepository repository;

    private static final String CONSUMER_GROUP = "test-consumer";
    private static final String EVENT_TYPE = "RecordUpdated";
    private static final String KIND = "DetailItem";
    private static final String KEY = "2416:12:1:1";

    @BeforeEach
    void setUp() {
        cleanDatabase();
    }

    @Test
    @DisplayName("First delivery runs the handler; redeliveries are ignored")
    void processesOnce() {
        printTestHeader("Process once");

        UUID eventId = UUID.randomUUID();
        AtomicInteger handlerCallCount = new AtomicInteger(0);

        boolean first = eventProcessor.processEvent(eventId, EVENT_TYPE, KIND, KEY, CONSUMER_GROUP,
            handlerCallCount::incrementAndGet);
        boolean second = eventProcessor.processEvent(eventId, EVENT_TYPE, KIND, KEY, CONSUMER_GROUP,
            handlerCallCount::incrementAndGet);

        assertTrue(first, "First event should be processed");
        assertFalse(second, "Duplicate should be skipped");
        assertEquals(1, handlerCallCount.get(), "Handler should only be called once");
        assertEquals(ProcessedEvent.ProcessingResult.SUCCESS,
            repository.findById(eventId).orElseThrow().getProcessingResult());
        assertEquals(1, repository.findByKindAndNaturalKeyOrderByProcessedAtAsc(KIND, KEY).size());

        printSuccess("Duplicate delivery correctly skipped");
    }

    @Test
    @DisplayName("Downstream sync failure is recorded as FAILED and the handler's writes are kept")
    void downstreamFailureRecorded() {
        printTestHeader("Downstream failure");

        UUID eventId = UUID.randomUUID();

        DownstreamSyncException thrown = assertThrows(DownstreamSyncException.class, () ->
            eventProcessor.processEvent(eventId, EVENT_TYPE, KIND, KEY, CONSUMER_GROUP, () -> {
                store.create(RecordKind.CONTACT, Map.of("name", "Written before sync"));
                throw DownstreamSyncException.rejected("board", "bad column");
            }));

        ProcessedEventEntity entity = repository.findById(eventId).orElseThrow();
        assertEquals(ProcessedEvent.ProcessingResult.FAILED, entity.getProcessingResult());
        assertEquals(thrown.getMessage(), entity.getErrorMessage());
        assertEquals(1, repository.countFailedByConsumerGroup(CONSUMER_GROUP));
        assertEquals(1, store.search(RecordKind.CONTACT).records().size());
        assertTrue(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP), "Not redelivered");

        printSuccess("Failure recorded, handler writes committed");
    }

    @Test
    @DisplayName("Any other failure rolls back and leaves the event for redelivery")
    void otherFailureRollsBack() {
        UUID eventId = UUID.randomUUID();

        assertThrows(IllegalStateException.class, () ->
            eventProcessor.processEvent(eventId, EVENT_TYPE, KIND, KEY, CONSUMER_GROUP, () -> {
                store.create(RecordKind.CONTACT, Map.of("name", "Rolled back"));
                throw new IllegalStateException("boom");
            }));

        assertFalse(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));
        assertTrue(store.search(RecordKind.CONTACT).isEmpty());
        assertTrue(eventProcessor.processEvent(eventId, EVENT_TYPE, KIND, KEY, CONSUMER_GROUP, () -> { }),
            "Redelivery is processed");
    }

    @Test
    @DisplayName("A skipped event is never processed later")
    void skipPreventsProcessing() {
        UUID eventId = UUID.randomUUID();
        AtomicInteger handlerCallCount = new AtomicInteger(0);

        eventProcessor.skipEvent(eventId, EVENT_TYPE, KIND, KEY, CONSUMER_GROUP, "Batch in progress");
        boolean processed = eventProcessor.processEvent(eventId, EVENT_TYPE, KIND, KEY, CONSUMER_GROUP,
            handlerCallCount::incrementAndGet);

        assertFalse(processed);
        assertEquals(0, handlerCallCount.get());
        ProcessedEventEntity entity = repository.findById(eventId).orElseThrow();
        assertEquals(ProcessedEvent.ProcessingResult.SKIPPED, entity.getProcessingResult());
        assertEquals("Batch in progress", entity.getErrorMessage());
    }
}
