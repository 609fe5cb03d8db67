package com.flagship.budget_reconciliation.batch;

/**
 * Per-kind tally of one load step.
 */
public record LoadCounts(int created, int updated, int unchanged, int failed) {

    public static LoadCounts empty() {
        return new LoadCounts(0, 0, 0, 0);
    }

    public LoadCounts plus(LoadCounts other) {
        return new LoadCounts(created + other.created, updated + other.updated,
            unchanged + other.unchanged, failed + other.failed);
    }

    LoadCounts withCreated() {
        return new LoadCounts(created + 1, updated, unchanged, failed);
    }

    LoadCounts withUpdated() {
        return new LoadCounts(created, updated + 1, unchanged, failed);
    }

    LoadCounts withUnchanged() {
        return new LoadCounts(created, updated, unchanged + 1, failed);
    }

    LoadCounts withFailed() {
        return new LoadCounts(created, updated, unchanged, failed + 1);
    }

    public int total() {
        return created + updated + unchanged + failed;
    }
}
