package com.flagship.budget_reconciliation.batch;

import com.flagship.budget_reconciliation.persistence.Filter;
import com.flagship.budget_reconciliation.persistence.RecordKind;
import com.flagship.budget_reconciliation.persistence.RecordStore;
import com.flagship.budget_reconciliation.persistence.StoredRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-project batch flag.
 *
 * While a project's BatchLog is STARTED its sibling sets may be incomplete, so
 * reconciliation and downstream sync skip its records. The flag is advisory: it
 * assumes one batch in flight per project and is not cleared if a worker dies.
 * Each status write commits on its own so other workers see it immediately.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchLogService {

    private static final List<String> LOOKUP = List.of("project_number");

    private final RecordStore store;
    private final Clock clock;

    @Transactional(readOnly = true)
    public boolean isInProgress(int projectNumber) {
        return status(projectNumber)
            .map(status -> status == BatchLogStatus.STARTED)
            .orElse(false);
    }

    @Transactional(readOnly = true)
    public Optional<BatchLogStatus> status(int projectNumber) {
        return find(projectNumber)
            .map(batch -> batch.getString("status"))
            .map(BatchLogStatus::valueOf);
    }

    /**
     * Sets the project's BatchLog to STARTED, creating it if absent.
     *
     * @throws BatchRunException if the flag cannot be written
     */
    @Transactional
    public StoredRecord markStarted(int projectNumber, String filename, String path) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("project_number", projectNumber);
        fields.put("filename", filename);
        fields.put("db_path", path);
        fields.put("status", BatchLogStatus.STARTED.name());

        Optional<StoredRecord> existing = find(projectNumber);
        Optional<StoredRecord> written = existing.isPresent()
            ? store.update(RecordKind.BATCH_LOG, existing.get().getId(), fields, LOOKUP)
            : store.create(RecordKind.BATCH_LOG, fields, LOOKUP);

        // a create that lost a race resolves to the other row, still at its old status
        if (written.isPresent() && !BatchLogStatus.STARTED.name().equals(written.get().getString("status"))) {
            written = store.update(RecordKind.BATCH_LOG, written.get().getId(), fields, LOOKUP);
        }
        StoredRecord batch = written.orElseThrow(() ->
            new BatchRunException(projectNumber, "Unable to set BatchLog to STARTED for project " + projectNumber));
        log.info("BatchLog STARTED: project={}, file={}", projectNumber, filename);
        return batch;
    }

    @Transactional
    public void markCompleted(int projectNumber) {
        if (!setStatus(projectNumber, BatchLogStatus.COMPLETED)) {
            throw new BatchRunException(projectNumber,
                "Unable to set BatchLog to COMPLETED for project " + projectNumber);
        }
        log.info("BatchLog COMPLETED: project={}", projectNumber);
    }

    /**
     * Best effort; a failure here is logged and the original error is what propagates.
     */
    @Transactional
    public void markFailed(int projectNumber) {
        if (setStatus(projectNumber, BatchLogStatus.FAILED)) {
            log.warn("BatchLog FAILED: project={}", projectNumber);
        } else {
            log.error("Could not set BatchLog to FAILED for project {}", projectNumber);
        }
    }

    /**
     * Batches STARTED and not touched for longer than {@code staleAfter}.
     */
    @Transactional(readOnly = true)
    public List<StoredRecord> findStale(Duration staleAfter) {
        Instant cutoff = clock.instant().minus(staleAfter);
        return store.search(RecordKind.BATCH_LOG, Filter.eq("status", BatchLogStatus.STARTED.name()))
            .records()
            .stream()
            .filter(batch -> {
                Object updatedAt = batch.get("updated_at");
                return updatedAt instanceof Instant touched && touched.isBefore(cutoff);
            })
            .toList();
    }

    private boolean setStatus(int projectNumber, BatchLogStatus status) {
        return find(projectNumber)
            .flatMap(batch -> store.update(RecordKind.BATCH_LOG, batch.getId(), Map.of("status", status.name())))
            .isPresent();
    }

    private Optional<StoredRecord> find(int projectNumber) {
        return store.findOne(RecordKind.BATCH_LOG, Filter.eq("project_number", projectNumber));
    }
}
