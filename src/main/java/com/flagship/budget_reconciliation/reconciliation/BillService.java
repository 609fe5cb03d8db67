package com.flagship.budget_reconciliation.reconciliation;

import com.flagship.budget_reconciliation.persistence.Filter;
import com.flagship.budget_reconciliation.persistence.RecordKind;
import com.flagship.budget_reconciliation.persistence.RecordStore;
import com.flagship.budget_reconciliation.persistence.StoredRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the Bill and BillLineItem for an invoice-backed detail item that is
 * ready to pay.
 *
 * One Bill per sibling group (project, PO, detail number); one line per detail item.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillService {

    private static final List<String> BILL_LINE_LOOKUP = List.of("parent_id", "line_number");

    private final RecordStore store;
    private final ReferenceDataResolver referenceData;

    /**
     * Finds or creates the item's Bill, then creates or refreshes its line.
     *
     * @return the line item, empty if either record could not be written
     */
    @Transactional
    public Optional<StoredRecord> ensureBillLine(StoredRecord item) {
        return ensureBill(item).flatMap(bill -> ensureLine(bill, item));
    }

    @Transactional
    public Optional<StoredRecord> ensureBill(StoredRecord item) {
        Map<String, Object> key = new LinkedHashMap<>();
        for (String column : RecordKind.BILL.naturalKey()) {
            key.put(column, item.get(column));
        }

        Optional<StoredRecord> existing = store.findOne(RecordKind.BILL, Filter.from(key, RecordKind.BILL.naturalKey()));
        if (existing.isPresent()) {
            return existing;
        }

        int projectNumber = item.getInteger("project_number");
        int poNumber = item.getInteger("po_number");
        Map<String, Object> fields = new LinkedHashMap<>(key);
        fields.put("reference", reference(projectNumber, poNumber, item.getInteger("detail_number")));
        fields.put("state", "DRAFT");
        fields.put("transaction_date", item.getDate("transaction_date"));
        fields.put("due_date", item.getDate("due_date"));
        fields.put("contact_id", referenceData.contactIdFor(projectNumber, poNumber));

        Optional<StoredRecord> created = store.create(RecordKind.BILL, fields, RecordKind.BILL.naturalKey());
        created.ifPresentOrElse(
            bill -> log.info("Bill {} ready: reference={}", bill.getId(), bill.getString("reference")),
            () -> log.warn("Could not create Bill for detail item {}", item.naturalKeyString()));
        return created;
    }

    private Optional<StoredRecord> ensureLine(StoredRecord bill, StoredRecord item) {
        BigDecimal amount = item.getDecimal("sub_total");
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("parent_id", bill.getId());
        fields.putAll(item.naturalKey());
        fields.put("description", item.getString("description"));
        fields.put("quantity", BigDecimal.ONE);
        fields.put("unit_amount", amount);
        fields.put("line_amount", amount);
        fields.put("account_code",
            referenceData.taxCodeFor(item.getInteger("project_number"), item.getString("account_code")));

        Optional<StoredRecord> existing = store.findOne(RecordKind.BILL_LINE_ITEM, Filter.from(fields, BILL_LINE_LOOKUP));
        if (existing.isEmpty()) {
            return store.create(RecordKind.BILL_LINE_ITEM, fields, BILL_LINE_LOOKUP);
        }
        if (!store.hasChanges(RecordKind.BILL_LINE_ITEM, existing.get().getId(), fields)) {
            return existing;
        }
        log.debug("Refreshing bill line {} of bill {}", existing.get().getId(), bill.getId());
        return store.update(RecordKind.BILL_LINE_ITEM, existing.get().getId(), fields, BILL_LINE_LOOKUP);
    }

    static String reference(int projectNumber, int poNumber, int detailNumber) {
        return projectNumber + "_" + poNumber + "_" + detailNumber;
    }
}
