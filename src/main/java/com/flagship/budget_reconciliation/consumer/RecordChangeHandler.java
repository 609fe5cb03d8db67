package com.flagship.budget_reconciliation.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.budget_reconciliation.persistence.RecordKind;
import com.flagship.budget_reconciliation.reconciliation.ReconciliationOutcome;
import com.flagship.budget_reconciliation.reconciliation.ReconciliationService;
import com.flagship.budget_reconciliation.sync.DownstreamSyncService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reacts to one record-changed notification.
 *
 * A DetailItem change triggers an evaluation of that item. Every change is then
 * mirrored downstream with the snapshot carried by the event. Runs inside the
 * idempotent processor's transaction; the evaluation commits separately, so the
 * sibling group lock is free again before the downstream call and its retries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordChangeHandler {

    private final ReconciliationService reconciliationService;
    private final DownstreamSyncService downstreamSyncService;

    public void onRecordChanged(RecordChangeEnvelope envelope) {
        // Evaluate first, in its own transaction
        if (RecordKind.DETAIL_ITEM.aggregateType().equals(envelope.kind())) {
            JsonNode snapshot = envelope.snapshot();
            ReconciliationOutcome outcome = reconciliationService.evaluate(
                snapshot.path("project_number").asInt(),
                snapshot.path("po_number").asInt(),
                snapshot.path("detail_number").asInt(),
                snapshot.path("line_number").asInt());
            log.debug("Evaluated {} {}: {}", envelope.kind(), envelope.naturalKey(), outcome);
        }

        // Then mirror the snapshot downstream, with retries
        downstreamSyncService.syncRecord(envelope.kind(), envelope.naturalKey(), envelope.snapshot());
    }
}
