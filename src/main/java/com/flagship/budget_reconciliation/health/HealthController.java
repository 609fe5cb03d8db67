package com.flagship.budget_reconciliation.health;

import com.flagship.budget_reconciliation.batch.BatchLogStatus;
import com.flagship.budget_reconciliation.outbox.OutboxService;
import com.flagship.budget_reconciliation.persistence.Filter;
import com.flagship.budget_reconciliation.persistence.RecordKind;
import com.flagship.budget_reconciliation.persistence.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Liveness endpoint that needs no actuator access.
 *
 * Answers 503 when the database is unreachable. Otherwise reports the projects
 * whose batch is running (their reconciliation is paused) and the outbox backlog.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final RecordStore store;
    private final OutboxService outboxService;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", clock.instant().toString());

        if (!databaseReachable()) {
            body.put("status", "DOWN");
            body.put("database", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }

        List<Integer> batching = store.search(RecordKind.BATCH_LOG,
                Filter.eq("status", BatchLogStatus.STARTED.name()))
            .records()
            .stream()
            .map(batch -> batch.getInteger("project_number"))
            .toList();

        body.put("status", "UP");
        body.put("database", "UP");
        body.put("projectsBatching", batching);
        body.put("outboxBacklog", outboxService.countUnpublished());
        return ResponseEntity.ok(body);
    }

    private boolean databaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database check failed: {}", e.getMessage());
            return false;
        }
    }
}
