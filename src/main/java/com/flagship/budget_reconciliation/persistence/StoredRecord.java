package com.flagship.budget_reconciliation.persistence;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Immutable snapshot of one stored row of a given kind.
 *
 * Values are held in their column's Java type (Integer, Long, BigDecimal,
 * LocalDate, Instant or String). The typed getters never coerce across types.
 */
@Value
public class StoredRecord {
    RecordKind kind;
    long id;
    Map<String, Object> fields;

    public static StoredRecord of(RecordKind kind, Map<String, Object> row) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        row.forEach((column, value) -> normalized.put(column,
            kind.columnType(column).map(type -> type.coerce(value)).orElse(value)));
        Object id = normalized.get(RecordKind.ID);
        if (id == null) {
            throw new IllegalArgumentException("Row of " + kind + " has no id");
        }
        return new StoredRecord(kind, (Long) id, Collections.unmodifiableMap(normalized));
    }

    public Object get(String field) {
        return fields.get(field);
    }

    public String getString(String field) {
        Object value = fields.get(field);
        return value == null ? null : value.toString();
    }

    public Integer getInteger(String field) {
        return (Integer) fields.get(field);
    }

    public Long getLong(String field) {
        return (Long) fields.get(field);
    }

    /**
     * Decimal value, treating a missing value as zero.
     */
    public BigDecimal getDecimal(String field) {
        Object value = fields.get(field);
        return value == null ? BigDecimal.ZERO : (BigDecimal) value;
    }

    public LocalDate getDate(String field) {
        return (LocalDate) fields.get(field);
    }

    /**
     * Natural key values in key order.
     */
    public Map<String, Object> naturalKey() {
        Map<String, Object> key = new LinkedHashMap<>();
        for (String column : kind.naturalKey()) {
            key.put(column, fields.get(column));
        }
        return key;
    }

    /**
     * Natural key rendered as {@code v1:v2:...}, used as the outbox aggregate id
     * and Kafka message key.
     */
    public String naturalKeyString() {
        return kind.naturalKey().stream()
            .map(column -> String.valueOf(fields.get(column)))
            .collect(Collectors.joining(":"));
    }
}
