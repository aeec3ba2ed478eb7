package com.flagship.payroll_ledger.config;

import com.flagship.payroll_ledger.posting.PayrollPostingSettings;
import com.flagship.payroll_ledger.posting.PostingRuleEngine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Binds payroll.posting.* to the settings used by the posting rule engine.
 */
@Configuration
public class PostingConfig {

    @Bean
    public PayrollPostingSettings payrollPostingSettings(
            @Value("${payroll.posting.accounts.salary-expense:6010}") String salaryExpense,
            @Value("${payroll.posting.accounts.cash:1100}") String cash,
            @Value("${payroll.posting.accounts.paye-payable:2110}") String payePayable,
            @Value("${payroll.posting.accounts.pension-payable:2120}") String pensionPayable,
            @Value("${payroll.posting.accounts.housing-fund-payable:2150}") String housingFundPayable,
            @Value("${payroll.posting.accounts.health-payable:2130}") String healthPayable,
            @Value("${payroll.posting.accounts.other-deductions-payable:2160}") String otherDeductionsPayable,
            @Value("${payroll.posting.accounts.employee-advances:1400}") String employeeAdvances,
            @Value("${payroll.posting.periods-per-year:12}") int periodsPerYear) {
        return new PayrollPostingSettings(salaryExpense, cash, payePayable, pensionPayable, housingFundPayable,
            healthPayable, otherDeductionsPayable, employeeAdvances, periodsPerYear);
    }

    @Bean
    public PostingRuleEngine postingRuleEngine(PayrollPostingSettings settings) {
        return new PostingRuleEngine(settings);
    }
}
