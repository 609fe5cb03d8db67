package com.flagship.budget_reconciliation.sync;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Boundary to an external system that mirrors record changes, such as a
 * project-tracking board or a bookkeeping ledger.
 *
 * Implementations receive the full current snapshot of one record per call and
 * report transient failures as retryable {@link DownstreamSyncException}s.
 */
public interface DownstreamSyncClient {

    /**
     * Short name used in logs and metrics.
     */
    String name();

    /**
     * Whether this collaborator mirrors records of the given kind.
     */
    boolean accepts(String kind);

    /**
     * Mirrors one record.
     *
     * @param kind record kind, e.g. "DetailItem"
     * @param naturalKey natural key string of the record
     * @param snapshot full current field values
     * @throws DownstreamSyncException when the collaborator fails
     */
    void sync(String kind, String naturalKey, JsonNode snapshot);
}
