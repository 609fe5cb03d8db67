package com.flagship.budget_reconciliation.batch;

import com.flagship.budget_reconciliation.reconciliation.ReconciliationOutcome;

import java.util.Map;

/**
 * Summary of a completed PO log batch run.
 *
 * @param evaluations post-batch evaluation results per outcome; items whose
 *                    evaluation threw are counted under {@code failedEvaluations}
 */
public record BatchRunResult(
        int projectNumber,
        String filename,
        int rowsRead,
        int rowsSkipped,
        int contacts,
        LoadCounts purchaseOrders,
        LoadCounts detailItems,
        Map<ReconciliationOutcome.Result, Integer> evaluations,
        int failedEvaluations) {
}
