package com.flagship.budget_reconciliation.reconciliation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Serializes evaluations of one sibling group (project, PO, detail number).
 *
 * Takes a PostgreSQL transaction-scoped advisory lock, released on commit or
 * rollback, so two evaluations of the same group never interleave their
 * read-modify-write of the siblings. Different groups proceed in parallel.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SiblingGroupLock {

    private final JdbcTemplate jdbcTemplate;

    @Transactional(propagation = Propagation.MANDATORY)
    public void acquire(int projectNumber, int poNumber, int detailNumber) {
        String key = groupKey(projectNumber, poNumber, detailNumber);
        jdbcTemplate.query("SELECT pg_advisory_xact_lock(hashtext(?))", (RowCallbackHandler) rs -> { }, key);
        log.debug("Acquired sibling group lock {}", key);
    }

    static String groupKey(int projectNumber, int poNumber, int detailNumber) {
        return "detail-group:" + projectNumber + ":" + poNumber + ":" + detailNumber;
    }
}
