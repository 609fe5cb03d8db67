package com.flagship.budget_reconciliation.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Metrics for ingestion, reconciliation and downstream sync.
 *
 * Metrics exposed:
 * - reconciliation.evaluations: evaluations by outcome
 * - reconciliation.transitions: state changes by from/to state
 * - reconciliation.evaluation.duration: time per evaluation
 * - batch.runs: batch runs by final status
 * - batch.duration: time per batch run
 * - polog.rows: rows parsed and skipped
 * - sync.attempts / sync.failures: downstream calls by collaborator and kind
 */
@Component
public class BudgetMetrics {

    private final MeterRegistry registry;

    private final Timer evaluationTimer;
    private final Timer batchTimer;
    private final Counter rowsParsed;
    private final Counter rowsSkipped;

    public BudgetMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.evaluationTimer = Timer.builder("reconciliation.evaluation.duration")
                .description("Time taken to evaluate one detail item")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.batchTimer = Timer.builder("batch.duration")
                .description("Time taken by one PO log batch run")
                .publishPercentiles(0.5, 0.95)
                .register(registry);

        this.rowsParsed = Counter.builder("polog.rows")
                .description("PO log rows read")
                .tag("result", "parsed")
                .register(registry);

        this.rowsSkipped = Counter.builder("polog.rows")
                .description("PO log rows read")
                .tag("result", "skipped")
                .register(registry);
    }

    // ==================== Reconciliation ====================

    public void recordEvaluation(String outcome) {
        registry.counter("reconciliation.evaluations", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordTransition(String from, String to) {
        registry.counter("reconciliation.transitions",
                "from", sanitizeTag(from),
                "to", sanitizeTag(to)
        ).increment();
    }

    public <T> T timeEvaluation(Supplier<T> evaluation) {
        return evaluationTimer.record(evaluation);
    }

    // ==================== Batch ====================

    public void recordBatchRun(String status, Duration duration) {
        registry.counter("batch.runs", "status", sanitizeTag(status)).increment();
        batchTimer.record(duration);
    }

    public void recordRows(int parsed, int skipped) {
        rowsParsed.increment(parsed);
        rowsSkipped.increment(skipped);
    }

    // ==================== Downstream sync ====================

    public void recordSyncAttempt(String client, String kind) {
        registry.counter("sync.attempts", "client", sanitizeTag(client), "kind", sanitizeTag(kind)).increment();
    }

    public void recordSyncFailure(String client, String kind) {
        registry.counter("sync.failures", "client", sanitizeTag(client), "kind", sanitizeTag(kind)).increment();
    }

    // ==================== Event consumption ====================

    public void recordEventProcessed(String kind, boolean wasNew) {
        registry.counter("event.processed",
                "kind", sanitizeTag(kind),
                "was_new", String.valueOf(wasNew)
        ).increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
