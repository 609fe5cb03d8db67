package com.flagship.budget_reconciliation.batch;

import lombok.Getter;

/**
 * A PO log batch run that could not finish.
 */
@Getter
public class BatchRunException extends RuntimeException {

    private final int projectNumber;

    public BatchRunException(int projectNumber, String message) {
        super(message);
        this.projectNumber = projectNumber;
    }

    public BatchRunException(int projectNumber, String message, Throwable cause) {
        super(message, cause);
        this.projectNumber = projectNumber;
    }
}
