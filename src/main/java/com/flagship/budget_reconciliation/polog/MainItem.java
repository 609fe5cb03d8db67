package com.flagship.budget_reconciliation.polog;

import com.flagship.budget_reconciliation.reconciliation.PaymentType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Purchase order as first seen in the log.
 * {@code amount} is the sum of the subtotals of all lines sharing the PO.
 */
@Value
@Builder
public class MainItem {
    int projectNumber;
    int poNumber;
    String contactName;
    String vendorType;
    String description;
    PaymentType poType;
    BigDecimal amount;
}
