package com.flagship.budget_reconciliation.persistence;

import com.flagship.budget_reconciliation.outbox.OutboxService;
import com.flagship.budget_reconciliation.outbox.RecordChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Savepoint;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Generic natural-key store over every {@link RecordKind}.
 *
 * Contract:
 * - search never throws; unknown columns or bad values give NotFound with a warning
 * - create and update never throw for record-level failures; they return empty
 * - a uniqueness conflict with a supplied uniqueLookup resolves to the record that
 *   already holds the key, so concurrent creators converge on one row
 * - every write runs inside a JDBC savepoint, so a failed statement does not poison
 *   the caller's transaction
 * - writes to kinds that announce changes queue a record-changed outbox event in
 *   the same transaction
 *
 * Plain JDBC rather than JPA: one code path serves all kinds, driven by the
 * kind descriptor, and ON CONFLICT is expressed directly.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordStore {

    private final JdbcTemplate jdbcTemplate;
    private final OutboxService outboxService;

    /**
     * Equality search. Empty filters return every record of the kind.
     */
    @Transactional(readOnly = true)
    public SearchResult search(RecordKind kind, List<Filter> filters) {
        List<Object> args = new ArrayList<>();
        String where;
        try {
            where = whereClause(kind, filters, args);
        } catch (IllegalArgumentException e) {
            log.warn("Search on {} rejected: {}", kind.table(), e.getMessage());
            return new SearchResult.NotFound();
        }

        String sql = "SELECT * FROM " + kind.table() + where + " ORDER BY id";
        try {
            List<StoredRecord> records = jdbcTemplate.queryForList(sql, args.toArray())
                .stream()
                .map(row -> StoredRecord.of(kind, row))
                .toList();
            return SearchResult.of(records);
        } catch (DataAccessException e) {
            log.warn("Search on {} failed: filters={}, error={}", kind.table(), filters, e.getMessage());
            return new SearchResult.NotFound();
        }
    }

    @Transactional(readOnly = true)
    public SearchResult search(RecordKind kind, Filter... filters) {
        return search(kind, Arrays.asList(filters));
    }

    /**
     * Lookup expected to hit at most one record. Several matches are an invariant
     * violation: logged, and treated as no result.
     */
    @Transactional(readOnly = true)
    public Optional<StoredRecord> findOne(RecordKind kind, List<Filter> filters) {
        SearchResult result = search(kind, filters);
        if (result instanceof SearchResult.One one) {
            return Optional.of(one.record());
        }
        if (result instanceof SearchResult.Many many) {
            log.warn("Expected one {} for {}, found {}", kind.aggregateType(), filters, many.records().size());
        }
        return Optional.empty();
    }

    @Transactional(readOnly = true)
    public Optional<StoredRecord> findOne(RecordKind kind, Filter... filters) {
        return findOne(kind, Arrays.asList(filters));
    }

    @Transactional(readOnly = true)
    public Optional<StoredRecord> findById(RecordKind kind, long id) {
        return findOne(kind, Filter.eq(RecordKind.ID, id));
    }

    @Transactional
    public Optional<StoredRecord> create(RecordKind kind, Map<String, ?> fields) {
        return create(kind, fields, null);
    }

    /**
     * Inserts a record.
     *
     * @param uniqueLookup field names whose values in {@code fields} identify an
     *                     existing record when the insert hits a uniqueness conflict;
     *                     null disables the fallback
     * @return the created record, the existing record on a resolved conflict, or empty
     */
    @Transactional
    public Optional<StoredRecord> create(RecordKind kind, Map<String, ?> fields, List<String> uniqueLookup) {
        // 1. Whitelist and coerce fields
        List<String> columns = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        try {
            bindWritable(kind, fields, columns, args);
        } catch (IllegalArgumentException e) {
            log.warn("Create on {} rejected: {}", kind.table(), e.getMessage());
            return Optional.empty();
        }
        if (columns.isEmpty()) {
            log.warn("Create on {} rejected: no writable fields", kind.table());
            return Optional.empty();
        }

        // 2. Insert; a key conflict returns no row instead of failing the transaction
        String sql = "INSERT INTO " + kind.table()
            + " (" + String.join(", ", columns) + ")"
            + " VALUES (" + columns.stream().map(c -> "?").collect(Collectors.joining(", ")) + ")"
            + " ON CONFLICT DO NOTHING RETURNING *";

        WriteAttempt attempt = attempt(sql, args.toArray());
        if (attempt.failure() != null) {
            if (attempt.failure() instanceof DuplicateKeyException) {
                return resolveConflict(kind, fields, uniqueLookup, "create");
            }
            log.warn("Create on {} failed: {}", kind.table(), attempt.failure().getMessage());
            return Optional.empty();
        }
        // 3. Lost the race: hand back the winner
        if (attempt.rows().isEmpty()) {
            return resolveConflict(kind, fields, uniqueLookup, "create");
        }

        // 4. Announce in the same transaction
        StoredRecord created = StoredRecord.of(kind, attempt.rows().get(0));
        log.debug("Created {} id={} key={}", kind.aggregateType(), created.getId(), created.naturalKeyString());
        announce(RecordChangedEvent.CREATED, created);
        return Optional.of(created);
    }

    @Transactional
    public Optional<StoredRecord> update(RecordKind kind, long id, Map<String, ?> fields) {
        return update(kind, id, fields, null);
    }

    /**
     * Updates the given fields of record {@code id}.
     *
     * A uniqueness violation (e.g. moving the record onto another record's key)
     * resolves through {@code uniqueLookup} the same way as {@link #create}.
     */
    @Transactional
    public Optional<StoredRecord> update(RecordKind kind, long id, Map<String, ?> fields, List<String> uniqueLookup) {
        List<String> columns = new ArrayList<>();
        List<Object> args = new ArrayList<>();
        try {
            bindWritable(kind, fields, columns, args);
        } catch (IllegalArgumentException e) {
            log.warn("Update on {} id={} rejected: {}", kind.table(), id, e.getMessage());
            return Optional.empty();
        }
        if (columns.isEmpty()) {
            return findById(kind, id);
        }

        // Runs in a savepoint; a constraint violation rolls back only this statement
        String sql = "UPDATE " + kind.table()
            + " SET " + columns.stream().map(c -> c + " = ?").collect(Collectors.joining(", "))
            + ", updated_at = CURRENT_TIMESTAMP"
            + " WHERE id = ? RETURNING *";
        args.add(id);

        WriteAttempt attempt = attempt(sql, args.toArray());
        if (attempt.failure() != null) {
            if (attempt.failure() instanceof DuplicateKeyException) {
                return resolveConflict(kind, fields, uniqueLookup, "update");
            }
            log.warn("Update on {} id={} failed: {}", kind.table(), id, attempt.failure().getMessage());
            return Optional.empty();
        }
        if (attempt.rows().isEmpty()) {
            log.warn("Update on {} id={} matched no record", kind.table(), id);
            return Optional.empty();
        }

        StoredRecord updated = StoredRecord.of(kind, attempt.rows().get(0));
        log.debug("Updated {} id={} fields={}", kind.aggregateType(), id, columns);
        announce(RecordChangedEvent.UPDATED, updated);
        return Optional.of(updated);
    }

    /**
     * True if any candidate field differs from record {@code id}, or the record is missing.
     * The state column compares case-insensitively.
     */
    @Transactional(readOnly = true)
    public boolean hasChanges(RecordKind kind, long id, Map<String, ?> candidate) {
        return findById(kind, id)
            .map(current -> differs(current, candidate))
            .orElse(true);
    }

    /**
     * As {@link #hasChanges(RecordKind, long, Map)}, locating the record by natural-key filters.
     */
    @Transactional(readOnly = true)
    public boolean hasChanges(RecordKind kind, List<Filter> uniqueLookup, Map<String, ?> candidate) {
        return findOne(kind, uniqueLookup)
            .map(current -> differs(current, candidate))
            .orElse(true);
    }

    boolean differs(StoredRecord current, Map<String, ?> candidate) {
        RecordKind kind = current.getKind();
        for (Map.Entry<String, ?> entry : candidate.entrySet()) {
            String field = entry.getKey();
            Optional<ColumnType> type = kind.columnType(field);
            if (type.isEmpty()) {
                log.warn("Ignoring unknown field {} when comparing {}", field, kind.table());
                continue;
            }
            // Compare in the column type, as the value would be stored
            Object wanted;
            try {
                wanted = type.get().coerce(entry.getValue());
            } catch (IllegalArgumentException e) {
                log.warn("Field {} of {} not comparable: {}", field, kind.table(), e.getMessage());
                return true;
            }
            if (!type.get().same(current.get(field), wanted, kind.isCaseInsensitive(field))) {
                log.debug("{} id={} differs on {}: {} -> {}",
                    kind.aggregateType(), current.getId(), field, current.get(field), wanted);
                return true;
            }
        }
        return false;
    }

    private Optional<StoredRecord> resolveConflict(RecordKind kind, Map<String, ?> fields,
                                                   List<String> uniqueLookup, String operation) {
        if (uniqueLookup == null || uniqueLookup.isEmpty()) {
            log.info("Uniqueness conflict on {} {} without lookup keys; returning nothing",
                operation, kind.table());
            return Optional.empty();
        }
        List<Filter> lookup = Filter.from(fields, uniqueLookup);
        Optional<StoredRecord> existing = search(kind, lookup).first();
        if (existing.isPresent()) {
            log.info("Uniqueness conflict on {} {}; resolved to existing id={}",
                operation, kind.table(), existing.get().getId());
        } else {
            log.warn("Uniqueness conflict on {} {} but lookup {} found nothing", operation, kind.table(), lookup);
        }
        return existing;
    }

    private void announce(String eventType, StoredRecord record) {
        if (record.getKind().announcesChanges()) {
            outboxService.recordChanged(eventType, record);
        }
    }

    private String whereClause(RecordKind kind, List<Filter> filters, List<Object> args) {
        if (filters == null || filters.isEmpty()) {
            return "";
        }
        List<String> predicates = new ArrayList<>();
        for (Filter filter : filters) {
            ColumnType type = kind.columnType(filter.field())
                .orElseThrow(() -> new IllegalArgumentException("Unknown column " + filter.field()));
            Object value = type.coerce(filter.value());
            if (value == null) {
                predicates.add(filter.field() + " IS NULL");
            } else {
                predicates.add(filter.field() + " = ?");
                args.add(value);
            }
        }
        return " WHERE " + String.join(" AND ", predicates);
    }

    private void bindWritable(RecordKind kind, Map<String, ?> fields, List<String> columns, List<Object> args) {
        for (Map.Entry<String, ?> entry : fields.entrySet()) {
            String field = entry.getKey();
            if (!kind.isWritable(field)) {
                throw new IllegalArgumentException("Column " + field + " is not writable on " + kind.table());
            }
            columns.add(field);
            args.add(kind.columnType(field).orElseThrow().coerce(entry.getValue()));
        }
    }

    private WriteAttempt attempt(String sql, Object[] args) {
        return jdbcTemplate.execute((ConnectionCallback<WriteAttempt>) connection -> {
            Savepoint savepoint = connection.setSavepoint();
            try {
                List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, args);
                connection.releaseSavepoint(savepoint);
                return new WriteAttempt(rows, null);
            } catch (DataAccessException e) {
                connection.rollback(savepoint);
                return new WriteAttempt(List.of(), e);
            }
        });
    }

    private record WriteAttempt(List<Map<String, Object>> rows, DataAccessException failure) {
    }
}
