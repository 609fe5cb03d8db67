package com.flagship.budget_reconciliation.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.budget_reconciliation.observability.BudgetMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Hands a record snapshot to every downstream collaborator that mirrors its kind.
 *
 * Each collaborator call goes through the downstream retry template. A failure
 * after the retry cap is logged and counted, the remaining collaborators are
 * still called, and the failure is then surfaced to the caller.
 */
@Service
@Slf4j
public class DownstreamSyncService {

    private final List<DownstreamSyncClient> clients;
    private final RetryTemplate retryTemplate;
    private final BudgetMetrics metrics;

    public DownstreamSyncService(List<DownstreamSyncClient> clients,
                                 @Qualifier("downstreamSyncRetryTemplate") RetryTemplate retryTemplate,
                                 BudgetMetrics metrics) {
        this.clients = List.copyOf(clients);
        this.retryTemplate = retryTemplate;
        this.metrics = metrics;
    }

    /**
     * @return number of collaborators that received the record
     * @throws DownstreamSyncException (not retryable) naming every collaborator that failed
     */
    public int syncRecord(String kind, String naturalKey, JsonNode snapshot) {
        List<String> failures = new ArrayList<>();
        int synced = 0;

        for (DownstreamSyncClient client : clients) {
            if (!client.accepts(kind)) {
                continue;
            }
            try {
                retryTemplate.execute(context -> {
                    if (context.getRetryCount() > 0) {
                        log.info("Retrying sync: client={}, kind={}, key={}, attempt={}",
                            client.name(), kind, naturalKey, context.getRetryCount() + 1);
                    }
                    metrics.recordSyncAttempt(client.name(), kind);
                    client.sync(kind, naturalKey, snapshot);
                    return null;
                });
                synced++;
            } catch (RuntimeException e) {
                metrics.recordSyncFailure(client.name(), kind);
                log.error("Downstream sync gave up: client={}, kind={}, key={}, error={}",
                    client.name(), kind, naturalKey, e.getMessage());
                failures.add(client.name() + ": " + e.getMessage());
            }
        }

        if (!failures.isEmpty()) {
            throw new DownstreamSyncException(
                "Sync of " + kind + " " + naturalKey + " failed for " + String.join("; ", failures), false);
        }
        return synced;
    }
}
