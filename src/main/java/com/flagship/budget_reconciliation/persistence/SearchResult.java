package com.flagship.budget_reconciliation.persistence;

import java.util.List;
import java.util.Optional;

/**
 * Result of a natural-key search: nothing, exactly one record, or several.
 *
 * Callers branch on the variant instead of guessing whether they received a
 * scalar or a list.
 */
public sealed interface SearchResult {

    static SearchResult of(List<StoredRecord> records) {
        if (records.isEmpty()) {
            return new NotFound();
        }
        if (records.size() == 1) {
            return new One(records.get(0));
        }
        return new Many(List.copyOf(records));
    }

    /**
     * All matches, in id order.
     */
    List<StoredRecord> records();

    default boolean isEmpty() {
        return records().isEmpty();
    }

    /**
     * First match in id order, if any.
     */
    default Optional<StoredRecord> first() {
        return records().stream().findFirst();
    }

    record NotFound() implements SearchResult {
        @Override
        public List<StoredRecord> records() {
            return List.of();
        }
    }

    record One(StoredRecord record) implements SearchResult {
        @Override
        public List<StoredRecord> records() {
            return List.of(record);
        }
    }

    record Many(List<StoredRecord> records) implements SearchResult {
    }
}
