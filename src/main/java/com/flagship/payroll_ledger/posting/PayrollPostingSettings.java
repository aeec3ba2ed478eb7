package com.flagship.payroll_ledger.posting;

import lombok.Value;

/**
 * Account numbers and scaling used to post payroll runs.
 */
@Value
public class PayrollPostingSettings {
    String salaryExpenseAccount;
    String cashAccount;
    String payePayableAccount;
    String pensionPayableAccount;
    String housingFundPayableAccount;
    String healthPayableAccount;
    String otherDeductionsPayableAccount;
    String employeeAdvancesAccount;
    int periodsPerYear;

    public PayrollPostingSettings(String salaryExpenseAccount, String cashAccount, String payePayableAccount,
                                  String pensionPayableAccount, String housingFundPayableAccount,
                                  String healthPayableAccount, String otherDeductionsPayableAccount,
                                  String employeeAdvancesAccount, int periodsPerYear) {
        if (periodsPerYear <= 0) {
            throw new IllegalArgumentException("periodsPerYear must be positive: " + periodsPerYear);
        }
        this.salaryExpenseAccount = salaryExpenseAccount;
        this.cashAccount = cashAccount;
        this.payePayableAccount = payePayableAccount;
        this.pensionPayableAccount = pensionPayableAccount;
        this.housingFundPayableAccount = housingFundPayableAccount;
        this.healthPayableAccount = healthPayableAccount;
        this.otherDeductionsPayableAccount = otherDeductionsPayableAccount;
        this.employeeAdvancesAccount = employeeAdvancesAccount;
        this.periodsPerYear = periodsPerYear;
    }

    /**
     * Monthly payroll against the seeded chart of accounts.
     */
    public static PayrollPostingSettings defaults() {
        return new PayrollPostingSettings("6010", "1100", "2110", "2120", "2150", "2130", "2160", "1400", 12);
    }
}
