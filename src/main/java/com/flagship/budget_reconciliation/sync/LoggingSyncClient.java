package com.flagship.budget_reconciliation.sync;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Collaborator used when no external system is wired in: records what would
 * have been mirrored.
 */
@Component
@ConditionalOnProperty(name = "sync.logging-client.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class LoggingSyncClient implements DownstreamSyncClient {

    @Override
    public String name() {
        return "log";
    }

    @Override
    public boolean accepts(String kind) {
        return true;
    }

    @Override
    public void sync(String kind, String naturalKey, JsonNode snapshot) {
        log.info("No downstream collaborator configured; kind={}, key={}, state={}",
            kind, naturalKey, snapshot.path("state").asText(null));
    }
}
