package com.flagship.budget_reconciliation.reconciliation;

import com.flagship.budget_reconciliation.batch.BatchLogService;
import com.flagship.budget_reconciliation.observability.BudgetMetrics;
import com.flagship.budget_reconciliation.observability.CorrelationContext;
import com.flagship.budget_reconciliation.persistence.Filter;
import com.flagship.budget_reconciliation.persistence.RecordKind;
import com.flagship.budget_reconciliation.persistence.RecordStore;
import com.flagship.budget_reconciliation.persistence.StoredRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Reconciliation state machine for detail items.
 *
 * One evaluation runs, in order:
 * 1. matching against the proof of payment (skipped for terminal items)
 *    - CC/PC: the receipt at the item's key; the SpendMoney record follows the result
 *    - INV/PROJ: the invoice against the sum of the whole sibling group; every
 *      non-terminal sibling takes the group result
 * 2. bill creation for an invoice-backed item that is now RTP
 * 3. overdue escalation of REVIEWED / PO MISMATCH items past their due date
 * 4. final-amount audit of terminal items against their bookkeeping record
 * 5. a single write of the item, only when something changed
 *
 * The whole evaluation is one transaction holding the sibling group's advisory
 * lock, so group re-queries see this evaluation's own writes and no other
 * evaluation of the group interleaves. It always commits on its own, even when
 * called from an open transaction, so the lock is released before the caller
 * moves on to slower work such as downstream sync.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    /**
     * Two amounts match when they differ by strictly less than this.
     */
    public static final BigDecimal EPSILON = new BigDecimal("0.0001");

    private final RecordStore store;
    private final BatchLogService batchLogService;
    private final SiblingGroupLock groupLock;
    private final SpendMoneyService spendMoneyService;
    private final BillService billService;
    private final BudgetMetrics metrics;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ReconciliationOutcome evaluate(int projectNumber, int poNumber, int detailNumber, int lineNumber) {
        boolean owner = CorrelationContext.begin(projectNumber);
        try {
            ReconciliationOutcome outcome = metrics.timeEvaluation(
                () -> doEvaluate(projectNumber, poNumber, detailNumber, lineNumber));
            metrics.recordEvaluation(outcome.result().name());
            return outcome;
        } finally {
            CorrelationContext.end(owner);
        }
    }

    private ReconciliationOutcome doEvaluate(int projectNumber, int poNumber, int detailNumber, int lineNumber) {
        String key = projectNumber + ":" + poNumber + ":" + detailNumber + ":" + lineNumber;
        if (batchLogService.isInProgress(projectNumber)) {
            log.info("Batch in progress for project {}; skipping evaluation of {}", projectNumber, key);
            return ReconciliationOutcome.skipped();
        }

        // Held until commit; every sibling read below sees a settled group
        groupLock.acquire(projectNumber, poNumber, detailNumber);

        Optional<StoredRecord> found = store.findOne(RecordKind.DETAIL_ITEM,
            Filter.eq("project_number", projectNumber),
            Filter.eq("po_number", poNumber),
            Filter.eq("detail_number", detailNumber),
            Filter.eq("line_number", lineNumber));
        if (found.isEmpty()) {
            log.info("Detail item {} not found", key);
            return ReconciliationOutcome.notFound();
        }

        StoredRecord item = found.get();
        DetailItemState entry = DetailItemState.fromLabel(item.getString("state"));
        PaymentType type = PaymentType.fromStored(item.getString("payment_type"));
        Map<String, Object> links = new LinkedHashMap<>();
        DetailItemState state = entry;

        // Step 1: proof of payment
        if (!entry.isTerminal() && type != null) {
            state = type.isReceiptBacked()
                ? matchReceipt(item, state, links)
                : matchInvoiceGroup(item, state, links);
        }

        // Step 2: bill for invoice-backed items ready to pay
        if (state == DetailItemState.RTP && type != null && type.isInvoiceBacked()) {
            billService.ensureBillLine(item);
        }

        // Step 3: overdue escalation
        state = escalateIfOverdue(item, state);

        // Step 4: final-amount audit
        if (state.isTerminal() && type != null) {
            state = auditFinalAmount(item, type, state);
        }

        // Step 5: single write, only when something changed
        persist(item, entry, state, links);
        return ReconciliationOutcome.evaluated(entry, state);
    }

    private DetailItemState matchReceipt(StoredRecord item, DetailItemState current, Map<String, Object> links) {
        Optional<StoredRecord> receipt = store.findOne(RecordKind.RECEIPT,
            Filter.from(item.getFields(), RecordKind.RECEIPT.naturalKey()));
        if (receipt.isEmpty()) {
            log.debug("No receipt yet for detail item {}", item.naturalKeyString());
            spendMoneyService.upsert(item, false);
            return current;
        }

        boolean matched = amountsMatch(item.getDecimal("sub_total"), receipt.get().getDecimal("total"));
        links.put("receipt_id", receipt.get().getId());
        spendMoneyService.upsert(item, matched);
        log.debug("Receipt {} for detail item {}: subTotal={}, total={}, matched={}",
            receipt.get().getId(), item.naturalKeyString(),
            item.getDecimal("sub_total"), receipt.get().getDecimal("total"), matched);
        return matched ? DetailItemState.REVIEWED : DetailItemState.PO_MISMATCH;
    }

    private DetailItemState matchInvoiceGroup(StoredRecord item, DetailItemState current, Map<String, Object> links) {
        int projectNumber = item.getInteger("project_number");
        int poNumber = item.getInteger("po_number");
        int detailNumber = item.getInteger("detail_number");

        Optional<StoredRecord> invoice = store.findOne(RecordKind.INVOICE,
            Filter.eq("project_number", projectNumber),
            Filter.eq("po_number", poNumber),
            Filter.eq("invoice_number", detailNumber));
        if (invoice.isEmpty()) {
            log.debug("No invoice yet for group {}:{}:{}", projectNumber, poNumber, detailNumber);
            return current;
        }

        // Re-query the whole group, this item included
        List<StoredRecord> siblings = store.search(RecordKind.DETAIL_ITEM,
            Filter.eq("project_number", projectNumber),
            Filter.eq("po_number", poNumber),
            Filter.eq("detail_number", detailNumber)).records();
        BigDecimal groupTotal = siblings.stream()
            .map(sibling -> sibling.getDecimal("sub_total"))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal invoiceTotal = invoice.get().getDecimal("total");
        boolean matched = amountsMatch(groupTotal, invoiceTotal);
        DetailItemState groupState = matched ? DetailItemState.RTP : DetailItemState.PO_MISMATCH;
        long invoiceId = invoice.get().getId();

        log.info("Invoice {} for group {}:{}:{}: siblings={}, groupTotal={}, invoiceTotal={}, result={}",
            invoiceId, projectNumber, poNumber, detailNumber, siblings.size(), groupTotal, invoiceTotal,
            groupState.label());

        // Terminal siblings keep their state; the evaluated item is written last by persist()
        for (StoredRecord sibling : siblings) {
            if (sibling.getId() == item.getId()) {
                continue;
            }
            DetailItemState siblingState = DetailItemState.fromLabel(sibling.getString("state"));
            if (siblingState.isTerminal()) {
                continue;
            }
            // Past-due siblings take OVERDUE, as the evaluated item does
            DetailItemState target = escalateIfOverdue(sibling, groupState);
            Map<String, Object> fields = new LinkedHashMap<>();
            if (siblingState != target) {
                fields.put("state", target.label());
            }
            if (!Objects.equals(sibling.getLong("invoice_id"), invoiceId)) {
                fields.put("invoice_id", invoiceId);
            }
            if (fields.isEmpty()) {
                continue;
            }
            if (store.update(RecordKind.DETAIL_ITEM, sibling.getId(), fields).isEmpty()) {
                log.warn("Could not update sibling {} to {}", sibling.naturalKeyString(), target.label());
            } else if (siblingState != target) {
                metrics.recordTransition(siblingState.label(), target.label());
            }
        }

        links.put("invoice_id", invoiceId);
        return groupState;
    }

    /**
     * REVIEWED and PO MISMATCH items past their due date become OVERDUE.
     */
    private DetailItemState escalateIfOverdue(StoredRecord item, DetailItemState state) {
        LocalDate dueDate = item.getDate("due_date");
        if (state.canBecomeOverdue() && dueDate != null && dueDate.isBefore(LocalDate.now(clock))) {
            log.info("Detail item {} overdue since {}", item.naturalKeyString(), dueDate);
            return DetailItemState.OVERDUE;
        }
        return state;
    }

    private DetailItemState auditFinalAmount(StoredRecord item, PaymentType type, DetailItemState current) {
        List<Filter> key = Filter.from(item.getFields(), RecordKind.DETAIL_ITEM.naturalKey());
        Optional<BigDecimal> recorded = type.isInvoiceBacked()
            ? store.findOne(RecordKind.BILL_LINE_ITEM, key).map(line -> line.getDecimal("line_amount"))
            : store.findOne(RecordKind.SPEND_MONEY, key).map(spend -> spend.getDecimal("amount"));
        if (recorded.isEmpty()) {
            log.debug("No bookkeeping record to audit for {} item {}", current.label(), item.naturalKeyString());
            return current;
        }
        if (amountsMatch(item.getDecimal("sub_total"), recorded.get())) {
            return current;
        }
        log.warn("Final amount mismatch on {} item {}: subTotal={}, recorded={}",
            current.label(), item.naturalKeyString(), item.getDecimal("sub_total"), recorded.get());
        return DetailItemState.ISSUE;
    }

    private void persist(StoredRecord item, DetailItemState entry, DetailItemState exit, Map<String, Object> links) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (exit != entry) {
            fields.put("state", exit.label());
        }
        links.forEach((column, id) -> {
            if (!Objects.equals(item.getLong(column), id)) {
                fields.put(column, id);
            }
        });
        if (fields.isEmpty()) {
            return;
        }
        if (store.update(RecordKind.DETAIL_ITEM, item.getId(), fields).isEmpty()) {
            throw new IllegalStateException("Could not persist detail item " + item.naturalKeyString());
        }
        if (exit != entry) {
            log.info("Detail item {} {} -> {}", item.naturalKeyString(), entry.label(), exit.label());
            metrics.recordTransition(entry.label(), exit.label());
        }
    }

    /**
     * True when the amounts differ by strictly less than {@link #EPSILON}.
     * A missing amount reads as zero.
     */
    public static boolean amountsMatch(BigDecimal left, BigDecimal right) {
        BigDecimal l = left == null ? BigDecimal.ZERO : left;
        BigDecimal r = right == null ? BigDecimal.ZERO : right;
        return l.subtract(r).abs().compareTo(EPSILON) < 0;
    }
}
