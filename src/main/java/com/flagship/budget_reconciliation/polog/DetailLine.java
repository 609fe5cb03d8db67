package com.flagship.budget_reconciliation.polog;

import com.flagship.budget_reconciliation.reconciliation.DetailItemState;
import com.flagship.budget_reconciliation.reconciliation.PaymentType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One parsed transaction line of a PO log.
 */
@Value
@Builder
public class DetailLine {
    int projectNumber;
    int poNumber;
    int detailNumber;
    int lineNumber;
    PaymentType paymentType;
    DetailItemState state;
    String payId;
    String accountCode;
    String vendor;
    String description;
    LocalDate transactionDate;
    LocalDate dueDate;
    BigDecimal quantity;
    BigDecimal rate;
    BigDecimal ot;
    BigDecimal fringes;
    BigDecimal subTotal;

    /**
     * Content columns, everything except the key and the state.
     */
    public Map<String, Object> contentFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("payment_type", paymentType.name());
        fields.put("account_code", accountCode);
        fields.put("vendor", vendor);
        fields.put("description", description);
        fields.put("transaction_date", transactionDate);
        fields.put("due_date", dueDate);
        fields.put("rate", toColumnScale(rate));
        fields.put("quantity", toColumnScale(quantity));
        fields.put("ot", toColumnScale(ot));
        fields.put("fringes", toColumnScale(fringes));
        return fields;
    }

    // Amount columns hold two decimals; compare and write what the column will store
    private static BigDecimal toColumnScale(BigDecimal value) {
        return value == null ? null : value.setScale(2, RoundingMode.HALF_UP);
    }

    public Map<String, Object> keyFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("project_number", projectNumber);
        fields.put("po_number", poNumber);
        fields.put("detail_number", detailNumber);
        fields.put("line_number", lineNumber);
        return fields;
    }

    /**
     * Every column written when the item is first created.
     */
    public Map<String, Object> toCreateFields() {
        Map<String, Object> fields = keyFields();
        fields.putAll(contentFields());
        fields.put("state", state.label());
        return fields;
    }
}
