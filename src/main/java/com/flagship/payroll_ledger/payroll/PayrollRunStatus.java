package com.flagship.payroll_ledger.payroll;

/**
 * Lifecycle of a payroll run.
 *
 * Status fields are not "just columns" - they have rules and constraints.
 */
public enum PayrollRunStatus {
    /**
     * Lines and pay components may still be added.
     */
    OPEN,

    /**
     * Close in progress. Only visible inside the closing transaction;
     * a failed close rolls the run back to OPEN.
     */
    CLOSING,

    /**
     * Terminal. The run's journal (if any) has been posted.
     */
    CLOSED
}
