package com.flagship.budget_reconciliation.observability;

import com.flagship.budget_reconciliation.batch.BatchLogService;
import com.flagship.budget_reconciliation.persistence.StoredRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Periodic monitoring work kept off the request path:
 * - outbox gauges, which need database queries
 * - the stale-batch watchdog, which logs every BatchLog left at STARTED
 */
@Component
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final BatchLogService batchLogService;
    private final Duration staleAfter;

    public MetricsScheduler(OutboxMetrics outboxMetrics,
                            BatchLogService batchLogService,
                            @Value("${batch.stale-after-minutes:60}") long staleAfterMinutes) {
        this.outboxMetrics = outboxMetrics;
        this.batchLogService = batchLogService;
        this.staleAfter = Duration.ofMinutes(staleAfterMinutes);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }

    @Scheduled(fixedRateString = "${batch.watchdog-interval-ms:300000}")
    public void reportStaleBatches() {
        List<StoredRecord> stale = batchLogService.findStale(staleAfter);
        for (StoredRecord batch : stale) {
            log.warn("Batch still STARTED after {} min: project={}, file={}, since={}",
                staleAfter.toMinutes(), batch.getInteger("project_number"),
                batch.getString("filename"), batch.get("updated_at"));
        }
    }
}
