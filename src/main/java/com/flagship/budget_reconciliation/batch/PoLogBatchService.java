package com.flagship.budget_reconciliation.batch;

import com.flagship.budget_reconciliation.observability.BudgetMetrics;
import com.flagship.budget_reconciliation.observability.CorrelationContext;
import com.flagship.budget_reconciliation.persistence.Filter;
import com.flagship.budget_reconciliation.persistence.RecordKind;
import com.flagship.budget_reconciliation.persistence.RecordStore;
import com.flagship.budget_reconciliation.persistence.StoredRecord;
import com.flagship.budget_reconciliation.polog.DetailLine;
import com.flagship.budget_reconciliation.polog.ParsedPoLog;
import com.flagship.budget_reconciliation.polog.PoLogParser;
import com.flagship.budget_reconciliation.reconciliation.ReconciliationOutcome;
import com.flagship.budget_reconciliation.reconciliation.ReconciliationService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Three-step PO log ingestion for one project.
 *
 * 1. set the project's BatchLog to STARTED, which holds back reconciliation and sync
 * 2. parse the file, then load contacts, purchase orders and detail items, in that order
 * 3. set the BatchLog to COMPLETED and evaluate every detail item of the project,
 *    since record events received during the batch were skipped
 *
 * Not transactional as a whole: every status write and every load chunk
 * commits on its own so other workers observe the batch flag.
 */
@Service
@Slf4j
public class PoLogBatchService {

    private final PoLogParser parser;
    private final BatchLogService batchLogService;
    private final ContactLoader contactLoader;
    private final PurchaseOrderLoader purchaseOrderLoader;
    private final DetailItemLoader detailItemLoader;
    private final ReconciliationService reconciliationService;
    private final RecordStore store;
    private final BudgetMetrics metrics;
    private final Clock clock;
    private final int chunkSize;

    public PoLogBatchService(PoLogParser parser,
                             BatchLogService batchLogService,
                             ContactLoader contactLoader,
                             PurchaseOrderLoader purchaseOrderLoader,
                             DetailItemLoader detailItemLoader,
                             ReconciliationService reconciliationService,
                             RecordStore store,
                             BudgetMetrics metrics,
                             Clock clock,
                             @Value("${batch.chunk-size:500}") int chunkSize) {
        this.parser = parser;
        this.batchLogService = batchLogService;
        this.contactLoader = contactLoader;
        this.purchaseOrderLoader = purchaseOrderLoader;
        this.detailItemLoader = detailItemLoader;
        this.reconciliationService = reconciliationService;
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
        this.chunkSize = Math.max(1, chunkSize);
    }

    /**
     * Runs the whole batch for one PO log file.
     *
     * @throws BatchRunException if the BatchLog cannot be set, or if parsing or
     *                           loading fails (the BatchLog is then FAILED)
     */
    public BatchRunResult run(Path file) {
        String filename = file.getFileName().toString();
        int projectNumber = Integer.parseInt(PoLogParser.projectNumberFrom(filename));
        boolean owner = CorrelationContext.begin(projectNumber);
        MDC.put(CorrelationContext.BATCH_FILE_MDC_KEY, filename);
        Instant started = clock.instant();
        try {
            // Step 1: gate the project; failing here aborts the run
            log.info("Batch starting: project={}, file={}", projectNumber, file);
            batchLogService.markStarted(projectNumber, filename, file.toString());

            ParsedPoLog parsed;
            Map<String, Long> contactIds;
            LoadCounts purchaseOrders;
            LoadCounts detailItems;
            // Step 2: parse, then load contacts before the purchase orders that link to them
            try {
                parsed = parser.parse(file);
                metrics.recordRows(parsed.getRowsRead() - parsed.getRowsSkipped(), parsed.getRowsSkipped());
                contactIds = contactLoader.load(parsed.getContacts());
                purchaseOrders = purchaseOrderLoader.load(projectNumber, parsed.getMainItems(), contactIds);
                detailItems = loadDetailItems(parsed.getDetailItems());
                // Step 3: open the gate
                batchLogService.markCompleted(projectNumber);
            } catch (IOException | RuntimeException e) {
                log.error("Batch failed: project={}, file={}, error={}", projectNumber, filename, e.getMessage(), e);
                batchLogService.markFailed(projectNumber);
                metrics.recordBatchRun(BatchLogStatus.FAILED.name(), Duration.between(started, clock.instant()));
                throw new BatchRunException(projectNumber, "PO log batch failed for " + filename, e);
            }

            metrics.recordBatchRun(BatchLogStatus.COMPLETED.name(), Duration.between(started, clock.instant()));
            // Notifications raised during the batch were skipped; catch up on every item
            Map<ReconciliationOutcome.Result, Integer> evaluations = new EnumMap<>(ReconciliationOutcome.Result.class);
            int failedEvaluations = reevaluateProject(projectNumber, evaluations);

            BatchRunResult result = new BatchRunResult(projectNumber, filename,
                parsed.getRowsRead(), parsed.getRowsSkipped(), contactIds.size(),
                purchaseOrders, detailItems, evaluations, failedEvaluations);
            log.info("Batch completed: project={}, purchaseOrders={}, detailItems={}, evaluations={}, failedEvaluations={}",
                projectNumber, purchaseOrders, detailItems, evaluations, failedEvaluations);
            return result;
        } finally {
            MDC.remove(CorrelationContext.BATCH_FILE_MDC_KEY);
            CorrelationContext.end(owner);
        }
    }

    private LoadCounts loadDetailItems(List<DetailLine> lines) {
        LoadCounts counts = LoadCounts.empty();
        for (int from = 0; from < lines.size(); from += chunkSize) {
            List<DetailLine> chunk = lines.subList(from, Math.min(from + chunkSize, lines.size()));
            counts = counts.plus(detailItemLoader.loadChunk(chunk));
        }
        log.info("Detail items loaded: total={}, chunks={}, {}",
            lines.size(), (lines.size() + chunkSize - 1) / chunkSize, counts);
        return counts;
    }

    /**
     * Evaluates every detail item of the project, each in its own transaction.
     * One item failing does not stop the others.
     *
     * @return number of evaluations that failed
     */
    int reevaluateProject(int projectNumber, Map<ReconciliationOutcome.Result, Integer> tally) {
        List<StoredRecord> items = store.search(RecordKind.DETAIL_ITEM, Filter.eq("project_number", projectNumber))
            .records();
        int failed = 0;
        for (StoredRecord item : items) {
            try {
                ReconciliationOutcome outcome = reconciliationService.evaluate(
                    item.getInteger("project_number"),
                    item.getInteger("po_number"),
                    item.getInteger("detail_number"),
                    item.getInteger("line_number"));
                tally.merge(outcome.result(), 1, Integer::sum);
            } catch (RuntimeException e) {
                failed++;
                log.error("Evaluation failed for detail item {}: {}", item.naturalKeyString(), e.getMessage(), e);
            }
        }
        return failed;
    }
}
