package com.flagship.budget_reconciliation.reconciliation;

import com.flagship.budget_reconciliation.IntegrationTestSupport;
import com.flagship.budget_reconciliation.batch.BatchLogService;
import com.flagship.budget_reconciliation.outbox.OutboxService;
import com.flagship.budget_reconciliation.persistence.Filter;
import com.flagship.budget_reconciliation.persistence.RecordKind;
import com.flagship.budget_reconciliation.persistence.StoredRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reconciliation state machine against real records:
 * - invoice matching across a sibling group, with Bill creation on RTP
 * - receipt matching with the 0.0001 tolerance and SpendMoney authorization
 * - overdue escalation, terminal final-amount audit and batch gating
 */
class ReconciliationServiceTest extends IntegrationTestSupport {

    private static final int PROJECT = 2416;
    private static final int PO = 12;

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private BatchLogService batchLogService;

    @Autowired
    private OutboxService outboxService;

    @BeforeEach
    void setUp() {
        cleanDatabase();
    }

    private DetailItemState stateOf(int detail, int line) {
        return DetailItemState.fromLabel(detailItem(PROJECT, PO, detail, line).getString("state"));
    }

    private StoredRecord createBillLine(StoredRecord item, String lineAmount) {
        Map<String, Object> bill = new LinkedHashMap<>();
        bill.put("project_number", PROJECT);
        bill.put("po_number", PO);
        bill.put("detail_number", item.getInteger("detail_number"));
        long billId = store.create(RecordKind.BILL, bill).orElseThrow().getId();

        Map<String, Object> line = new LinkedHashMap<>(item.naturalKey());
        line.put("parent_id", billId);
        line.put("line_amount", new BigDecimal(lineAmount));
        line.put("unit_amount", new BigDecimal(lineAmount));
        return store.create(RecordKind.BILL_LINE_ITEM, line).orElseThrow();
    }

    @Nested
    @DisplayName("Invoice-backed sibling groups")
    class InvoiceGroups {

        @BeforeEach
        void createGroup() {
            createDetailItem(PROJECT, PO, 1, 1, "INV", "PENDING", "10.00", null);
            createDetailItem(PROJECT, PO, 1, 2, "INV", "PENDING", "20.00", null);
            createDetailItem(PROJECT, PO, 1, 3, "INV", "PENDING", "70.00", null);
        }

        @Test
        @DisplayName("Group total equal to the invoice moves every sibling to RTP and builds the bill")
        void groupMatchesInvoice() {
            printTestHeader("Sibling group matches invoice");

            StoredRecord invoice = createInvoice(PROJECT, PO, 1, "100.00");

            ReconciliationOutcome outcome = reconciliationService.evaluate(PROJECT, PO, 1, 1);

            assertEquals(ReconciliationOutcome.Result.CHANGED, outcome.result());
            assertEquals(DetailItemState.PENDING, outcome.entryState());
            assertEquals(DetailItemState.RTP, outcome.exitState());
            for (int line = 1; line <= 3; line++) {
                StoredRecord item = detailItem(PROJECT, PO, 1, line);
                assertEquals(DetailItemState.RTP, DetailItemState.fromLabel(item.getString("state")), "line " + line);
                assertEquals(invoice.getId(), item.getLong("invoice_id"), "line " + line);
            }

            StoredRecord bill = store.findOne(RecordKind.BILL,
                Filter.eq("project_number", PROJECT), Filter.eq("po_number", PO), Filter.eq("detail_number", 1))
                .orElseThrow();
            assertEquals("2416_12_1", bill.getString("reference"));
            assertEquals("DRAFT", bill.getString("state"));

            StoredRecord line = store.findOne(RecordKind.BILL_LINE_ITEM,
                Filter.eq("parent_id", bill.getId()), Filter.eq("line_number", 1)).orElseThrow();
            assertEquals(0, new BigDecimal("10.00").compareTo(line.getDecimal("line_amount")));
            assertEquals("5300", line.getString("account_code"), "No tax mapping falls back to the account code");

            printSuccess("All three siblings RTP, bill " + bill.getString("reference") + " created");
        }

        @Test
        @DisplayName("Group total differing from the invoice moves every sibling to PO MISMATCH")
        void groupMismatchesInvoice() {
            createInvoice(PROJECT, PO, 1, "99.00");

            ReconciliationOutcome outcome = reconciliationService.evaluate(PROJECT, PO, 1, 2);

            assertEquals(DetailItemState.PO_MISMATCH, outcome.exitState());
            assertEquals(DetailItemState.PO_MISMATCH, stateOf(1, 1));
            assertEquals(DetailItemState.PO_MISMATCH, stateOf(1, 2));
            assertEquals(DetailItemState.PO_MISMATCH, stateOf(1, 3));
            assertTrue(store.search(RecordKind.BILL).isEmpty());
        }

        @Test
        @DisplayName("A group without an invoice is left untouched")
        void noInvoiceYet() {
            ReconciliationOutcome outcome = reconciliationService.evaluate(PROJECT, PO, 1, 1);

            assertEquals(ReconciliationOutcome.Result.UNCHANGED, outcome.result());
            assertEquals(DetailItemState.PENDING, stateOf(1, 3));
        }

        @Test
        @DisplayName("A terminal sibling keeps its state but still counts towards the group total")
        void terminalSiblingKept() {
            store.update(RecordKind.DETAIL_ITEM, detailItem(PROJECT, PO, 1, 3).getId(), Map.of("state", "PAID"))
                .orElseThrow();
            createInvoice(PROJECT, PO, 1, "100.00");

            reconciliationService.evaluate(PROJECT, PO, 1, 1);

            assertEquals(DetailItemState.RTP, stateOf(1, 1));
            assertEquals(DetailItemState.RTP, stateOf(1, 2));
            assertEquals(DetailItemState.PAID, stateOf(1, 3));
        }

        @Test
        @DisplayName("Bill line account code follows the project's budget map to the tax account")
        void taxCodeMapping() {
            long taxId = store.create(RecordKind.TAX_ACCOUNT, Map.of("tax_code", "GST-5300")).orElseThrow().getId();
            store.create(RecordKind.ACCOUNT_CODE, Map.of("code", "5300", "budget_map_id", 7L, "tax_id", taxId))
                .orElseThrow();
            store.create(RecordKind.PROJECT, Map.of("project_number", PROJECT, "budget_map_id", 7L)).orElseThrow();
            createInvoice(PROJECT, PO, 1, "100.00");

            reconciliationService.evaluate(PROJECT, PO, 1, 2);

            StoredRecord line = store.findOne(RecordKind.BILL_LINE_ITEM,
                Filter.from(detailKey(PROJECT, PO, 1, 2), RecordKind.BILL_LINE_ITEM.naturalKey())).orElseThrow();
            assertEquals("GST-5300", line.getString("account_code"));
        }
    }

    @Nested
    @DisplayName("Receipt-backed items")
    class Receipts {

        @Test
        @DisplayName("A receipt within tolerance moves the item to REVIEWED and authorizes the spend")
        void receiptMatches() {
            printTestHeader("Receipt match");

            createDetailItem(PROJECT, PO, 4, 1, "CC", "SUBMITTED", "50.00", LocalDate.now().plusDays(10));
            StoredRecord receipt = createReceipt(PROJECT, PO, 4, 1, "50.0000");

            ReconciliationOutcome outcome = reconciliationService.evaluate(PROJECT, PO, 4, 1);

            assertEquals(DetailItemState.REVIEWED, outcome.exitState());
            assertEquals(receipt.getId(), detailItem(PROJECT, PO, 4, 1).getLong("receipt_id"));
            StoredRecord spend = store.findOne(RecordKind.SPEND_MONEY,
                Filter.from(detailKey(PROJECT, PO, 4, 1), RecordKind.SPEND_MONEY.naturalKey())).orElseThrow();
            assertEquals("AUTHORIZED", spend.getString("state"));
            assertEquals(0, new BigDecimal("50.00").compareTo(spend.getDecimal("amount")));

            printSuccess("Item REVIEWED, SpendMoney AUTHORIZED");
        }

        @Test
        @DisplayName("A difference of exactly 0.0001 is a mismatch and leaves the spend in draft")
        void toleranceBoundary() {
            createDetailItem(PROJECT, PO, 4, 1, "PC", "SUBMITTED", "50.00", LocalDate.now().plusDays(10));
            createReceipt(PROJECT, PO, 4, 1, "50.0001");

            ReconciliationOutcome outcome = reconciliationService.evaluate(PROJECT, PO, 4, 1);

            assertEquals(DetailItemState.PO_MISMATCH, outcome.exitState());
            StoredRecord spend = store.findOne(RecordKind.SPEND_MONEY,
                Filter.from(detailKey(PROJECT, PO, 4, 1), RecordKind.SPEND_MONEY.naturalKey())).orElseThrow();
            assertEquals("DRAFT", spend.getString("state"));
        }

        @Test
        @DisplayName("Without a receipt the state is kept and a draft spend is recorded")
        void noReceiptYet() {
            createDetailItem(PROJECT, PO, 4, 1, "CC", "SUBMITTED", "50.00", null);

            ReconciliationOutcome outcome = reconciliationService.evaluate(PROJECT, PO, 4, 1);

            assertEquals(ReconciliationOutcome.Result.UNCHANGED, outcome.result());
            assertEquals(1, store.search(RecordKind.SPEND_MONEY).records().size());
        }
    }

    @Test
    @DisplayName("REVIEWED past its due date becomes OVERDUE; a future due date does not")
    void overdueEscalation() {
        createDetailItem(PROJECT, PO, 5, 1, "INV", "REVIEWED", "10.00", LocalDate.now().minusDays(3));
        createDetailItem(PROJECT, PO, 6, 1, "INV", "REVIEWED", "10.00", LocalDate.now().plusDays(3));

        assertEquals(DetailItemState.OVERDUE, reconciliationService.evaluate(PROJECT, PO, 5, 1).exitState());
        assertEquals(ReconciliationOutcome.Result.UNCHANGED, reconciliationService.evaluate(PROJECT, PO, 6, 1).result());
        assertEquals(DetailItemState.OVERDUE, stateOf(5, 1));
        assertEquals(DetailItemState.REVIEWED, stateOf(6, 1));
    }

    @Test
    @DisplayName("Past-due siblings of a mismatched group all settle at OVERDUE")
    void mismatchedGroupPastDueSettles() {
        printTestHeader("Mismatched group past its due date");

        LocalDate pastDue = LocalDate.now().minusDays(3);
        createDetailItem(PROJECT, PO, 9, 1, "INV", "PENDING", "10.00", pastDue);
        createDetailItem(PROJECT, PO, 9, 2, "INV", "PENDING", "20.00", pastDue);
        createInvoice(PROJECT, PO, 9, "99.00");

        ReconciliationOutcome first = reconciliationService.evaluate(PROJECT, PO, 9, 1);
        assertEquals(DetailItemState.OVERDUE, first.exitState());
        assertEquals(DetailItemState.OVERDUE, stateOf(9, 2));

        ReconciliationOutcome sibling = reconciliationService.evaluate(PROJECT, PO, 9, 2);
        ReconciliationOutcome again = reconciliationService.evaluate(PROJECT, PO, 9, 1);

        assertEquals(ReconciliationOutcome.Result.UNCHANGED, sibling.result());
        assertEquals(ReconciliationOutcome.Result.UNCHANGED, again.result());
        assertEquals(DetailItemState.OVERDUE, stateOf(9, 1));
        assertEquals(DetailItemState.OVERDUE, stateOf(9, 2));
        assertEquals(1, outboxService.getEventsForRecord("DetailItem", "2416:12:9:2").stream()
            .filter(event -> "RecordUpdated".equals(event.getEventType()))
            .count());

        printSuccess("Group settled at OVERDUE without further writes");
    }

    @Nested
    @DisplayName("Terminal final-amount audit")
    class TerminalAudit {

        @Test
        @DisplayName("PAID with a bill line off by 0.001 becomes ISSUE")
        void mismatchBecomesIssue() {
            printTestHeader("Terminal audit mismatch");

            StoredRecord item = createDetailItem(PROJECT, PO, 7, 1, "INV", "PAID", "50.00", null);
            createBillLine(item, "50.001");

            ReconciliationOutcome outcome = reconciliationService.evaluate(PROJECT, PO, 7, 1);

            assertEquals(DetailItemState.PAID, outcome.entryState());
            assertEquals(DetailItemState.ISSUE, outcome.exitState());
            assertEquals(DetailItemState.ISSUE, stateOf(7, 1));

            printSuccess("PAID item downgraded to ISSUE");
        }

        @Test
        @DisplayName("PAID with an exactly matching bill line stays PAID")
        void exactMatchStaysPaid() {
            StoredRecord item = createDetailItem(PROJECT, PO, 7, 1, "INV", "PAID", "50.00", null);
            createBillLine(item, "50.00");

            ReconciliationOutcome outcome = reconciliationService.evaluate(PROJECT, PO, 7, 1);

            assertEquals(ReconciliationOutcome.Result.UNCHANGED, outcome.result());
            assertEquals(DetailItemState.PAID, stateOf(7, 1));
        }

        @Test
        @DisplayName("AUTHORIZED card spend is audited against its SpendMoney amount")
        void spendMoneyAudit() {
            createDetailItem(PROJECT, PO, 8, 1, "CC", "AUTHORIZED", "25.00", null);
            Map<String, Object> spend = new LinkedHashMap<>(detailKey(PROJECT, PO, 8, 1));
            spend.put("amount", new BigDecimal("24.00"));
            spend.put("state", "AUTHORIZED");
            store.create(RecordKind.SPEND_MONEY, spend).orElseThrow();

            assertEquals(DetailItemState.ISSUE, reconciliationService.evaluate(PROJECT, PO, 8, 1).exitState());
        }

        @Test
        @DisplayName("A terminal item without a bookkeeping record keeps its state")
        void missingRecordKeepsState() {
            createDetailItem(PROJECT, PO, 7, 1, "INV", "RECONCILED", "50.00", null);

            assertEquals(ReconciliationOutcome.Result.UNCHANGED,
                reconciliationService.evaluate(PROJECT, PO, 7, 1).result());
        }
    }

    @Test
    @DisplayName("Evaluation is skipped while the project's batch is running and resumes once it completes")
    void batchGating() {
        printTestHeader("Batch gating");

        createDetailItem(PROJECT, PO, 1, 1, "INV", "PENDING", "100.00", null);
        createInvoice(PROJECT, PO, 1, "100.00");
        startBatch(PROJECT);

        ReconciliationOutcome skipped = reconciliationService.evaluate(PROJECT, PO, 1, 1);
        assertEquals(ReconciliationOutcome.Result.SKIPPED_BATCH_IN_PROGRESS, skipped.result());
        assertEquals(DetailItemState.PENDING, stateOf(1, 1));

        batchLogService.markCompleted(PROJECT);

        ReconciliationOutcome evaluated = reconciliationService.evaluate(PROJECT, PO, 1, 1);
        assertEquals(DetailItemState.RTP, evaluated.exitState());

        printSuccess("Skipped during batch, RTP after completion");
    }

    @Test
    @DisplayName("Evaluating an unknown key reports NOT_FOUND")
    void unknownItem() {
        assertEquals(ReconciliationOutcome.Result.NOT_FOUND,
            reconciliationService.evaluate(PROJECT, PO, 42, 1).result());
        assertEquals(List.of(), store.search(RecordKind.DETAIL_ITEM).records());
    }
}
