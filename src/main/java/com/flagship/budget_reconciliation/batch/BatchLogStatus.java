package com.flagship.budget_reconciliation.batch;

/**
 * Status of a project's PO log batch.
 * STARTED is the only status that holds back per-record processing.
 */
public enum BatchLogStatus {
    PENDING,
    STARTED,
    COMPLETED,
    FAILED
}
