package com.flagship.budget_reconciliation.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used across the service.
 *
 * The correlation id flows through HTTP requests (header or generated), batch
 * runs, reconciliation evaluations and consumed Kafka events, so every log line
 * of one unit of work can be grouped.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String PROJECT_NUMBER_MDC_KEY = "projectNumber";
    public static final String BATCH_FILE_MDC_KEY = "batchFile";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Current correlation id, generating one if none is set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }

    /**
     * Starts a unit of work: sets a fresh correlation id (unless one is already
     * set) and the project in MDC.
     *
     * @return true if this call set the correlation id and must therefore clear it
     */
    public static boolean begin(Integer projectNumber) {
        boolean owner = !hasCorrelationId();
        if (owner) {
            setCorrelationId(generateCorrelationId());
            MDC.put(CORRELATION_ID_MDC_KEY, correlationId.get());
        }
        if (projectNumber != null) {
            MDC.put(PROJECT_NUMBER_MDC_KEY, String.valueOf(projectNumber));
        }
        return owner;
    }

    /**
     * Ends a unit of work started with {@link #begin}.
     */
    public static void end(boolean owner) {
        MDC.remove(PROJECT_NUMBER_MDC_KEY);
        if (owner) {
            clear();
            MDC.remove(CORRELATION_ID_MDC_KEY);
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short id, readable in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
