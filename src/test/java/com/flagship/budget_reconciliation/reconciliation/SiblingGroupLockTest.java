package com.flagship.budget_reconciliation.reconciliation;

import com.flagship.budget_reconciliation.IntegrationTestSupport;
import com.flagship.budget_reconciliation.outbox.OutboxService;
import com.flagship.budget_reconciliation.persistence.RecordKind;
import com.flagship.budget_reconciliation.persistence.StoredRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Evaluations of one sibling group never interleave:
 * - an evaluation waits while another transaction holds the group lock
 * - concurrent evaluations of different lines leave one consistent group state
 */
class SiblingGroupLockTest extends IntegrationTestSupport {

    private static final int PROJECT = 2416;
    private static final int PO = 12;

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private SiblingGroupLock groupLock;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private OutboxService outboxService;

    @BeforeEach
    void setUp() {
        cleanDatabase();
        createDetailItem(PROJECT, PO, 1, 1, "INV", "PENDING", "10.00", null);
        createDetailItem(PROJECT, PO, 1, 2, "INV", "PENDING", "20.00", null);
        createDetailItem(PROJECT, PO, 1, 3, "INV", "PENDING", "70.00", null);
    }

    @Test
    @DisplayName("An evaluation waits until the group lock holder commits")
    void evaluationWaitsForLockHolder() throws Exception {
        printTestHeader("Evaluation blocked by group lock");

        createInvoice(PROJECT, PO, 1, "100.00");
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        try {
            Future<?> holder = executor.submit(() -> transactionTemplate.executeWithoutResult(status -> {
                groupLock.acquire(PROJECT, PO, 1);
                locked.countDown();
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }));
            assertTrue(locked.await(10, TimeUnit.SECONDS));

            Future<ReconciliationOutcome> evaluation =
                executor.submit(() -> reconciliationService.evaluate(PROJECT, PO, 1, 2));

            Thread.sleep(500);
            assertFalse(evaluation.isDone(), "Evaluation must wait for the lock");
            assertEquals(DetailItemState.PENDING,
                DetailItemState.fromLabel(detailItem(PROJECT, PO, 1, 2).getString("state")));

            release.countDown();
            holder.get(10, TimeUnit.SECONDS);
            assertEquals(ReconciliationOutcome.Result.CHANGED, evaluation.get(10, TimeUnit.SECONDS).result());

            printSuccess("Evaluation ran only after the lock was released");
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Concurrent evaluations of one group agree and link the invoice once per sibling")
    void concurrentEvaluationsAgree() throws Exception {
        printTestHeader("Concurrent evaluations of one group");

        long invoiceId = createInvoice(PROJECT, PO, 1, "100.00").getId();
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ReconciliationOutcome>> futures = new ArrayList<>();
        try {
            for (int line : new int[] {1, 2}) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return reconciliationService.evaluate(PROJECT, PO, 1, line);
                }));
            }
            start.countDown();

            List<ReconciliationOutcome.Result> results = new ArrayList<>();
            for (Future<ReconciliationOutcome> future : futures) {
                ReconciliationOutcome outcome = future.get(30, TimeUnit.SECONDS);
                assertEquals(DetailItemState.RTP, outcome.exitState());
                results.add(outcome.result());
            }

            // The first evaluation moves the whole group; the second finds it settled
            assertTrue(results.contains(ReconciliationOutcome.Result.CHANGED));
            assertTrue(results.contains(ReconciliationOutcome.Result.UNCHANGED));

            for (int line = 1; line <= 3; line++) {
                StoredRecord sibling = detailItem(PROJECT, PO, 1, line);
                assertEquals("RTP", sibling.getString("state"));
                assertEquals(Long.valueOf(invoiceId), sibling.getLong("invoice_id"));
                assertEquals(1, outboxService.getEventsForRecord("DetailItem", sibling.naturalKeyString()).stream()
                    .filter(event -> "RecordUpdated".equals(event.getEventType()))
                    .count(), "one update for line " + line);
            }
            assertEquals(1, store.search(RecordKind.BILL).records().size());

            printSuccess("Both evaluations saw one consistent RTP group");
        } finally {
            executor.shutdownNow();
        }
    }
}
