package com.flagship.budget_reconciliation.reconciliation;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle states of a detail item.
 *
 * Stored labels are uppercase; "PO MISMATCH" contains a space. Every comparison
 * with a stored or external value goes through {@link #fromLabel}, which trims,
 * uppercases and accepts an underscore for the space, so "po mismatch",
 * "PO_MISMATCH" and "PO MISMATCH" are the same state.
 *
 * PAID, RECONCILED, AUTHORIZED and APPROVED are terminal: automatic matching
 * never moves an item into or out of them, except that the final-amount audit
 * may downgrade one to ISSUE.
 */
public enum DetailItemState {
    PENDING("PENDING"),
    SUBMITTED("SUBMITTED"),
    REVIEWED("REVIEWED"),
    RTP("RTP"),
    PO_MISMATCH("PO MISMATCH"),
    OVERDUE("OVERDUE"),
    ISSUE("ISSUE"),
    PAID("PAID"),
    RECONCILED("RECONCILED"),
    AUTHORIZED("AUTHORIZED"),
    APPROVED("APPROVED");

    private static final Set<DetailItemState> TERMINAL = EnumSet.of(PAID, RECONCILED, AUTHORIZED, APPROVED);

    private final String label;

    DetailItemState(String label) {
        this.label = label;
    }

    /**
     * Value as stored in the database and sent downstream.
     */
    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * States the overdue check escalates once the due date has passed.
     */
    public boolean canBecomeOverdue() {
        return this == REVIEWED || this == PO_MISMATCH;
    }

    /**
     * Normalizes and parses a stored label. A missing label reads as PENDING.
     *
     * @throws IllegalArgumentException for an unknown label
     */
    public static DetailItemState fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('_', ' ');
        for (DetailItemState state : values()) {
            if (state.label.equals(normalized)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown detail item state: " + raw);
    }
}
