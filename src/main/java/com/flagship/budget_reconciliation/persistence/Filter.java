package com.flagship.budget_reconciliation.persistence;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Equality constraint on one column. A null value matches SQL NULL.
 */
public record Filter(String field, Object value) {

    public static Filter eq(String field, Object value) {
        return new Filter(field, value);
    }

    /**
     * Builds filters for the given field names, taking values from {@code fields}.
     */
    public static List<Filter> from(Map<String, ?> fields, List<String> names) {
        List<Filter> filters = new ArrayList<>(names.size());
        for (String name : names) {
            filters.add(new Filter(name, fields.get(name)));
        }
        return filters;
    }
}
