package com.flagship.budget_reconciliation.persistence;

import com.flagship.budget_reconciliation.IntegrationTestSupport;
import com.flagship.budget_reconciliation.outbox.OutboxEvent;
import com.flagship.budget_reconciliation.outbox.OutboxService;
import com.flagship.budget_reconciliation.outbox.RecordChangedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Natural-key store behavior against a real PostgreSQL schema:
 * - search variants (NotFound, One, Many) and rejected filters
 * - create and update conflict resolution through the unique lookup
 * - concurrent creators converging on a single row
 * - change detection and outbox notifications
 */
class RecordStoreTest extends IntegrationTestSupport {

    @Autowired
    private OutboxService outboxService;

    @BeforeEach
    void setUp() {
        cleanDatabase();
    }

    private Optional<StoredRecord> createContact(String name) {
        return store.create(RecordKind.CONTACT, Map.of("name", name, "vendor_type", "Vendor"), List.of("name"));
    }

    @Test
    @DisplayName("Search distinguishes no match, one match and several matches")
    void searchVariants() {
        printTestHeader("Search variants");

        createDetailItem(2416, 12, 1, 1, "INV", "PENDING", "10.00", null);
        createDetailItem(2416, 12, 1, 2, "INV", "PENDING", "20.00", null);

        SearchResult none = store.search(RecordKind.DETAIL_ITEM, Filter.eq("po_number", 99));
        SearchResult one = store.search(RecordKind.DETAIL_ITEM,
            Filter.eq("po_number", 12), Filter.eq("line_number", 2));
        SearchResult many = store.search(RecordKind.DETAIL_ITEM,
            Filter.eq("project_number", 2416), Filter.eq("po_number", 12), Filter.eq("detail_number", 1));

        assertInstanceOf(SearchResult.NotFound.class, none);
        assertInstanceOf(SearchResult.One.class, one);
        assertInstanceOf(SearchResult.Many.class, many);
        assertEquals(2, many.records().size());
        assertTrue(store.findOne(RecordKind.DETAIL_ITEM, Filter.eq("po_number", 12)).isEmpty(),
            "Ambiguous findOne yields nothing");

        printSuccess("NotFound, One and Many returned as expected");
    }

    @Test
    @DisplayName("Unknown columns and unconvertible values give NotFound instead of an error")
    void rejectedFilters() {
        assertInstanceOf(SearchResult.NotFound.class,
            store.search(RecordKind.DETAIL_ITEM, Filter.eq("no_such_column", 1)));
        assertInstanceOf(SearchResult.NotFound.class,
            store.search(RecordKind.DETAIL_ITEM, Filter.eq("po_number", "twelve")));
    }

    @Test
    @DisplayName("Generated sub_total is computed by the database and cannot be written")
    void generatedSubTotal() {
        StoredRecord item = createDetailItem(2416, 12, 1, 1, "INV", "PENDING", "12.50", null);
        assertEquals(0, new BigDecimal("12.50").compareTo(item.getDecimal("sub_total")));

        Map<String, Object> fields = detailKey(2416, 12, 1, 2);
        fields.put("payment_type", "INV");
        fields.put("sub_total", new BigDecimal("1"));
        assertTrue(store.create(RecordKind.DETAIL_ITEM, fields).isEmpty());
        assertTrue(store.update(RecordKind.DETAIL_ITEM, item.getId(), Map.of("sub_total", 1)).isEmpty());
    }

    @Test
    @DisplayName("Create on an existing key resolves to the existing record when a lookup is given")
    void createConflictResolution() {
        printTestHeader("Create conflict resolution");

        StoredRecord first = createContact("Acme Grip").orElseThrow();
        Optional<StoredRecord> second = createContact("Acme Grip");
        Optional<StoredRecord> withoutLookup = store.create(RecordKind.CONTACT, Map.of("name", "Acme Grip"));

        assertTrue(second.isPresent());
        assertEquals(first.getId(), second.get().getId());
        assertTrue(withoutLookup.isEmpty(), "No lookup keys means no fallback");
        assertEquals(1, store.search(RecordKind.CONTACT).records().size());

        printSuccess("Conflict resolved to id " + first.getId());
    }

    @Test
    @DisplayName("Update onto another record's key resolves through the lookup")
    void updateConflictResolution() {
        StoredRecord acme = createContact("Acme Grip").orElseThrow();
        StoredRecord other = createContact("Acme Grips").orElseThrow();

        Optional<StoredRecord> result = store.update(RecordKind.CONTACT, other.getId(),
            Map.of("name", "Acme Grip"), List.of("name"));

        assertEquals(acme.getId(), result.orElseThrow().getId());
        assertEquals("Acme Grips", store.findById(RecordKind.CONTACT, other.getId()).orElseThrow().getString("name"));
    }

    @Test
    @DisplayName("Concurrent creators of the same key all receive the single winning record")
    void concurrentCreatesConverge() throws Exception {
        printTestHeader("Concurrent creates");

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<StoredRecord>>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return createContact("Home Depot");
                }));
            }
            start.countDown();

            List<Long> ids = new ArrayList<>();
            for (Future<Optional<StoredRecord>> future : futures) {
                ids.add(future.get(30, TimeUnit.SECONDS).orElseThrow().getId());
            }

            assertEquals(1, ids.stream().distinct().count(), "All callers see the same id: " + ids);
            assertEquals(1, store.search(RecordKind.CONTACT, Filter.eq("name", "Home Depot")).records().size());
            printSuccess(threads + " concurrent creates converged on id " + ids.get(0));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Change detection ignores state case and decimal scale")
    void hasChanges() {
        StoredRecord item = createDetailItem(2416, 12, 1, 1, "INV", "RTP", "10.00", LocalDate.of(2024, 6, 1));

        assertFalse(store.hasChanges(RecordKind.DETAIL_ITEM, item.getId(),
            Map.of("state", "rtp", "rate", new BigDecimal("10"), "due_date", "2024-06-01")));
        assertTrue(store.hasChanges(RecordKind.DETAIL_ITEM, item.getId(), Map.of("rate", new BigDecimal("10.01"))));
        assertTrue(store.hasChanges(RecordKind.DETAIL_ITEM, item.getId(), Map.of("state", "PAID")));
        assertTrue(store.hasChanges(RecordKind.DETAIL_ITEM, 9999L, Map.of("state", "RTP")), "Missing record");
        assertTrue(store.hasChanges(RecordKind.DETAIL_ITEM,
            Filter.from(detailKey(2416, 12, 1, 9), RecordKind.DETAIL_ITEM.naturalKey()), Map.of("state", "RTP")));
    }

    @Test
    @DisplayName("Writes to announcing kinds queue a record-changed event; reference kinds do not")
    void outboxEventsWritten() {
        printTestHeader("Outbox notifications");

        StoredRecord item = createDetailItem(2416, 12, 1, 1, "INV", "PENDING", "10.00", null);
        store.update(RecordKind.DETAIL_ITEM, item.getId(), Map.of("state", "RTP")).orElseThrow();
        createReceipt(2416, 12, 1, 1, "10.00");

        List<OutboxEvent> events = outboxService.getEventsForRecord("DetailItem", "2416:12:1:1");
        assertEquals(2, events.size());
        assertEquals(RecordChangedEvent.CREATED, events.get(0).getEventType());
        assertEquals(RecordChangedEvent.UPDATED, events.get(1).getEventType());
        assertEquals(Integer.valueOf(2416), events.get(1).getProjectNumber());
        assertTrue(events.get(1).getPayload().contains("\"state\":\"RTP\""));
        assertTrue(outboxService.getEventsForRecord("Receipt", "2416:12:1:1").isEmpty());

        printSuccess("Two DetailItem events queued, none for Receipt");
    }
}
