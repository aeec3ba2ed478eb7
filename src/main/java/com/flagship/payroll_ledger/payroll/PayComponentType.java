package com.flagship.payroll_ledger.payroll;

public enum PayComponentType {
    /**
     * Earnings already included in net pay. Not posted separately.
     */
    ALLOWANCE,

    /**
     * Withheld from pay and owed to a third party.
     */
    DEDUCTION,

    /**
     * Repayment of an employee advance withheld from pay.
     */
    IOU_RECOVERY
}
