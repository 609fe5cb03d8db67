package com.flagship.budget_reconciliation.persistence;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Locale;

/**
 * Column types understood by the generic record store.
 *
 * Each type knows how to coerce a caller-supplied value into the Java type bound
 * to JDBC, how to read the driver's value back, and how two values compare.
 * Coercion failures raise IllegalArgumentException; the store turns those into
 * an empty result with a warning.
 */
public enum ColumnType {

    TEXT {
        @Override
        Object coerceNonNull(Object value) {
            return value.toString();
        }
    },

    INTEGER {
        @Override
        Object coerceNonNull(Object value) {
            if (value instanceof Integer i) {
                return i;
            }
            if (value instanceof Number n) {
                return Math.toIntExact(n.longValue());
            }
            return Integer.valueOf(value.toString().trim());
        }
    },

    BIGINT {
        @Override
        Object coerceNonNull(Object value) {
            if (value instanceof Long l) {
                return l;
            }
            if (value instanceof Number n) {
                return n.longValue();
            }
            return Long.valueOf(value.toString().trim());
        }
    },

    DECIMAL {
        @Override
        Object coerceNonNull(Object value) {
            if (value instanceof BigDecimal d) {
                return d;
            }
            if (value instanceof Integer || value instanceof Long) {
                return BigDecimal.valueOf(((Number) value).longValue());
            }
            if (value instanceof Number n) {
                return BigDecimal.valueOf(n.doubleValue());
            }
            return new BigDecimal(value.toString().trim().replace(",", ""));
        }

        @Override
        boolean sameNonNull(Object left, Object right) {
            return ((BigDecimal) left).compareTo((BigDecimal) right) == 0;
        }
    },

    DATE {
        @Override
        Object coerceNonNull(Object value) {
            if (value instanceof LocalDate d) {
                return d;
            }
            if (value instanceof Date d) {
                return d.toLocalDate();
            }
            return LocalDate.parse(value.toString().trim());
        }
    },

    TIMESTAMP {
        @Override
        Object coerceNonNull(Object value) {
            if (value instanceof Instant i) {
                return i;
            }
            if (value instanceof Timestamp t) {
                return t.toInstant();
            }
            if (value instanceof OffsetDateTime o) {
                return o.toInstant();
            }
            return Instant.parse(value.toString().trim());
        }
    };

    abstract Object coerceNonNull(Object value);

    /**
     * Converts a caller or driver value to this column's Java type.
     *
     * @throws IllegalArgumentException if the value cannot be represented
     */
    public Object coerce(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return coerceNonNull(value);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException(
                String.format("Cannot convert '%s' to %s", value, name().toLowerCase(Locale.ROOT)), e);
        }
    }

    /**
     * Compares two already coerced values.
     * With {@code caseInsensitive} set, text values are compared after uppercasing.
     */
    public boolean same(Object left, Object right, boolean caseInsensitive) {
        if (left == null || right == null) {
            return left == right;
        }
        if (caseInsensitive && left instanceof String l && right instanceof String r) {
            return l.toUpperCase(Locale.ROOT).equals(r.toUpperCase(Locale.ROOT));
        }
        return sameNonNull(left, right);
    }

    boolean sameNonNull(Object left, Object right) {
        return left.equals(right);
    }
}
