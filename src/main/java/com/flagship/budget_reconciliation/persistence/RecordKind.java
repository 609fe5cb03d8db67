package com.flagship.budget_reconciliation.persistence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.flagship.budget_reconciliation.persistence.ColumnType.BIGINT;
import static com.flagship.budget_reconciliation.persistence.ColumnType.DATE;
import static com.flagship.budget_reconciliation.persistence.ColumnType.DECIMAL;
import static com.flagship.budget_reconciliation.persistence.ColumnType.INTEGER;
import static com.flagship.budget_reconciliation.persistence.ColumnType.TEXT;
import static com.flagship.budget_reconciliation.persistence.ColumnType.TIMESTAMP;

/**
 * Descriptor for every record kind the store can read and write.
 *
 * A kind names its table, the columns reachable for filtering and writing, the
 * columns forming its natural key, and whether changes to it are announced
 * through the outbox. Column names used in SQL come only from these descriptors.
 */
public enum RecordKind {

    PROJECT("project", "Project", false,
        List.of("project_number"),
        column("project_number", INTEGER),
        column("name", TEXT),
        column("status", TEXT),
        column("budget_map_id", BIGINT)),

    ACCOUNT_CODE("account_code", "AccountCode", false,
        List.of("code", "budget_map_id"),
        column("code", TEXT),
        column("budget_map_id", BIGINT),
        column("tax_id", BIGINT),
        column("description", TEXT)),

    TAX_ACCOUNT("tax_account", "TaxAccount", false,
        List.of("tax_code"),
        column("tax_code", TEXT),
        column("description", TEXT),
        column("tax_ledger_id", BIGINT)),

    CONTACT("contact", "Contact", true,
        List.of("name"),
        column("name", TEXT),
        column("vendor_type", TEXT),
        column("vendor_status", TEXT),
        column("payment_details", TEXT),
        column("email", TEXT),
        column("tax_type", TEXT),
        column("tax_number", TEXT)),

    PURCHASE_ORDER("purchase_order", "PurchaseOrder", true,
        List.of("project_number", "po_number"),
        column("project_number", INTEGER),
        column("po_number", INTEGER),
        column("description", TEXT),
        column("po_type", TEXT),
        column("state", TEXT),
        column("vendor_name", TEXT),
        column("amount", DECIMAL),
        column("producer", TEXT),
        column("contact_id", BIGINT),
        column("project_id", BIGINT)),

    DETAIL_ITEM("detail_item", "DetailItem", true,
        List.of("project_number", "po_number", "detail_number", "line_number"),
        column("project_number", INTEGER),
        column("po_number", INTEGER),
        column("detail_number", INTEGER),
        column("line_number", INTEGER),
        column("payment_type", TEXT),
        column("state", TEXT),
        column("account_code", TEXT),
        column("vendor", TEXT),
        column("description", TEXT),
        column("transaction_date", DATE),
        column("due_date", DATE),
        column("rate", DECIMAL),
        column("quantity", DECIMAL),
        column("ot", DECIMAL),
        column("fringes", DECIMAL),
        derived("sub_total", DECIMAL),
        column("receipt_id", BIGINT),
        column("invoice_id", BIGINT)),

    RECEIPT("receipt", "Receipt", false,
        List.of("project_number", "po_number", "detail_number", "line_number"),
        column("project_number", INTEGER),
        column("po_number", INTEGER),
        column("detail_number", INTEGER),
        column("line_number", INTEGER),
        column("total", DECIMAL),
        column("purchase_date", DATE),
        column("description", TEXT),
        column("status", TEXT)),

    INVOICE("invoice", "Invoice", false,
        List.of("project_number", "po_number", "invoice_number"),
        column("project_number", INTEGER),
        column("po_number", INTEGER),
        column("invoice_number", INTEGER),
        column("total", DECIMAL),
        column("term", INTEGER),
        column("status", TEXT),
        column("transaction_date", DATE)),

    SPEND_MONEY("spend_money", "SpendMoney", true,
        List.of("project_number", "po_number", "detail_number", "line_number"),
        column("project_number", INTEGER),
        column("po_number", INTEGER),
        column("detail_number", INTEGER),
        column("line_number", INTEGER),
        column("amount", DECIMAL),
        column("description", TEXT),
        column("state", TEXT),
        column("transaction_date", DATE),
        column("tax_code", TEXT),
        column("contact_id", BIGINT)),

    BILL("bill", "Bill", true,
        List.of("project_number", "po_number", "detail_number"),
        column("project_number", INTEGER),
        column("po_number", INTEGER),
        column("detail_number", INTEGER),
        column("state", TEXT),
        column("reference", TEXT),
        column("transaction_date", DATE),
        column("due_date", DATE),
        column("contact_id", BIGINT)),

    BILL_LINE_ITEM("bill_line_item", "BillLineItem", true,
        List.of("project_number", "po_number", "detail_number", "line_number"),
        column("parent_id", BIGINT),
        column("project_number", INTEGER),
        column("po_number", INTEGER),
        column("detail_number", INTEGER),
        column("line_number", INTEGER),
        column("description", TEXT),
        column("quantity", DECIMAL),
        column("unit_amount", DECIMAL),
        column("line_amount", DECIMAL),
        column("account_code", TEXT)),

    BATCH_LOG("batch_log", "BatchLog", false,
        List.of("project_number"),
        column("project_number", INTEGER),
        column("filename", TEXT),
        column("db_path", TEXT),
        column("status", TEXT));

    public static final String ID = "id";

    private static final Set<String> CASE_INSENSITIVE_COLUMNS = Set.of("state");

    private final String table;
    private final String aggregateType;
    private final boolean announcesChanges;
    private final List<String> naturalKey;
    private final Map<String, ColumnType> columns;
    private final Set<String> writableColumns;

    RecordKind(String table, String aggregateType, boolean announcesChanges,
               List<String> naturalKey, Column... declared) {
        this.table = table;
        this.aggregateType = aggregateType;
        this.announcesChanges = announcesChanges;
        this.naturalKey = naturalKey;

        Map<String, ColumnType> all = new LinkedHashMap<>();
        all.put(ID, BIGINT);
        Set<String> writable = new LinkedHashSet<>();
        for (Column c : declared) {
            all.put(c.name(), c.type());
            if (c.writable()) {
                writable.add(c.name());
            }
        }
        all.put("created_at", TIMESTAMP);
        all.put("updated_at", TIMESTAMP);
        this.columns = Collections.unmodifiableMap(all);
        this.writableColumns = Collections.unmodifiableSet(writable);
    }

    public String table() {
        return table;
    }

    /**
     * Name used for this kind in outbox events and logs.
     */
    public String aggregateType() {
        return aggregateType;
    }

    /**
     * Whether a create or update of this kind writes a record-changed event.
     */
    public boolean announcesChanges() {
        return announcesChanges;
    }

    public List<String> naturalKey() {
        return naturalKey;
    }

    public Map<String, ColumnType> columns() {
        return columns;
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    public boolean isWritable(String name) {
        return writableColumns.contains(name);
    }

    public Optional<ColumnType> columnType(String name) {
        return Optional.ofNullable(columns.get(name));
    }

    public boolean isCaseInsensitive(String name) {
        return CASE_INSENSITIVE_COLUMNS.contains(name);
    }

    private static Column column(String name, ColumnType type) {
        return new Column(name, type, true);
    }

    private static Column derived(String name, ColumnType type) {
        return new Column(name, type, false);
    }

    private record Column(String name, ColumnType type, boolean writable) {
    }
}
