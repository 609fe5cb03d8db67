package com.flagship.budget_reconciliation.reconciliation;

import java.util.Locale;

/**
 * How a detail line is paid, which decides what proves the payment.
 */
public enum PaymentType {
    /** Credit card; proven by a receipt. */
    CC,
    /** Petty cash; proven by a receipt inside an envelope. */
    PC,
    /** Vendor invoice; proven by an invoice covering the sibling group. */
    INV,
    /** Project invoice; treated like INV. */
    PROJ;

    /**
     * Maps the log's payment-type code: CRD is a credit card, PC is petty cash,
     * anything else is an invoice.
     */
    public static PaymentType fromLogCode(String code) {
        String normalized = code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "CRD" -> CC;
            case "PC" -> PC;
            default -> INV;
        };
    }

    /**
     * Parses a stored value. Unknown values yield null.
     */
    public static PaymentType fromStored(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public boolean isReceiptBacked() {
        return this == CC || this == PC;
    }

    public boolean isInvoiceBacked() {
        return this == INV || this == PROJ;
    }
}
