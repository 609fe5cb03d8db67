package com.flagship.budget_reconciliation.reconciliation;

/**
 * What one evaluation of a detail item did.
 *
 * @param result     kind of outcome
 * @param entryState state read at the start, null when the item was not evaluated
 * @param exitState  state after the evaluation, null when the item was not evaluated
 */
public record ReconciliationOutcome(Result result, DetailItemState entryState, DetailItemState exitState) {

    public enum Result {
        SKIPPED_BATCH_IN_PROGRESS,
        NOT_FOUND,
        UNCHANGED,
        CHANGED
    }

    static ReconciliationOutcome skipped() {
        return new ReconciliationOutcome(Result.SKIPPED_BATCH_IN_PROGRESS, null, null);
    }

    static ReconciliationOutcome notFound() {
        return new ReconciliationOutcome(Result.NOT_FOUND, null, null);
    }

    static ReconciliationOutcome evaluated(DetailItemState entry, DetailItemState exit) {
        return new ReconciliationOutcome(entry == exit ? Result.UNCHANGED : Result.CHANGED, entry, exit);
    }

    public boolean changed() {
        return result == Result.CHANGED;
    }
}
