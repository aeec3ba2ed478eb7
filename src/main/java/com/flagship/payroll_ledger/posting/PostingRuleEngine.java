package com.flagship.payroll_ledger.posting;

import com.flagship.payroll_ledger.ledger.JournalEntryRequest;
import com.flagship.payroll_ledger.payroll.PayComponentType;
import com.flagship.payroll_ledger.payroll.PayrollRunLine;
import com.flagship.payroll_ledger.payroll.PayrollRunSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a payroll run into journal entry requests.
 *
 * Per employee the full cost is debited to salary expense; it is paid out as net pay
 * (cash) and the rest is owed to third parties (tax, pension, housing fund, health,
 * other deductions) or recovers an earlier advance. The debit is the sum of the credits,
 * so the journal always balances.
 *
 * Annual statutory contributions are divided by the number of pay periods per year.
 * Allowances are already part of net pay and produce no entry. Zero amounts are skipped.
 *
 * Entries are grouped by account in a fixed order, and within each group ordered by
 * employee id, so the same run always yields the same journal.
 */
@Slf4j
public class PostingRuleEngine {

    private final PayrollPostingSettings settings;

    public PostingRuleEngine(PayrollPostingSettings settings) {
        this.settings = settings;
    }

    public List<JournalEntryRequest> deriveEntries(PayrollRunSnapshot snapshot) {
        List<JournalEntryRequest> salaryDebits = new ArrayList<>();
        List<JournalEntryRequest> cashCredits = new ArrayList<>();
        List<JournalEntryRequest> payeCredits = new ArrayList<>();
        List<JournalEntryRequest> pensionCredits = new ArrayList<>();
        List<JournalEntryRequest> housingCredits = new ArrayList<>();
        List<JournalEntryRequest> healthCredits = new ArrayList<>();
        List<JournalEntryRequest> deductionCredits = new ArrayList<>();
        List<JournalEntryRequest> advanceCredits = new ArrayList<>();

        List<PayrollRunLine> lines = snapshot.getLines().stream()
            .sorted(Comparator.comparing(PayrollRunLine::getEmployeeId))
            .toList();

        for (PayrollRunLine line : lines) {
            EmployeeFigures figures = figuresFor(snapshot, line);
            String who = describe(line);

            addDebit(salaryDebits, settings.getSalaryExpenseAccount(), figures.totalCost(), "Salary expense - " + who);
            addCredit(cashCredits, settings.getCashAccount(), figures.netPay, "Net pay - " + who);
            addCredit(payeCredits, settings.getPayePayableAccount(), figures.tax, "PAYE - " + who);
            addCredit(pensionCredits, settings.getPensionPayableAccount(), figures.pension, "Pension - " + who);
            addCredit(housingCredits, settings.getHousingFundPayableAccount(), figures.housingFund, "NHF - " + who);
            addCredit(healthCredits, settings.getHealthPayableAccount(), figures.health, "Health - " + who);
            addCredit(deductionCredits, settings.getOtherDeductionsPayableAccount(), figures.deductions,
                "Other deductions - " + who);
            addCredit(advanceCredits, settings.getEmployeeAdvancesAccount(), figures.advanceRecovery,
                "IOU recovery - " + who);
        }

        List<JournalEntryRequest> entries = new ArrayList<>();
        entries.addAll(salaryDebits);
        entries.addAll(cashCredits);
        entries.addAll(payeCredits);
        entries.addAll(pensionCredits);
        entries.addAll(housingCredits);
        entries.addAll(healthCredits);
        entries.addAll(deductionCredits);
        entries.addAll(advanceCredits);

        log.debug("Derived {} entries for {} lines of payroll run {}", entries.size(), lines.size(),
            snapshot.getRun().getId());
        return entries;
    }

    private EmployeeFigures figuresFor(PayrollRunSnapshot snapshot, PayrollRunLine line) {
        return new EmployeeFigures(
            JournalEntryRequest.quantize(line.getNetPay()),
            JournalEntryRequest.quantize(line.getIncomeTax()),
            perPeriod(line.getAnnualPension()),
            perPeriod(line.getAnnualHousingFund()),
            perPeriod(line.getAnnualHealth()),
            JournalEntryRequest.quantize(snapshot.componentTotal(line.getEmployeeId(), PayComponentType.DEDUCTION)),
            JournalEntryRequest.quantize(snapshot.componentTotal(line.getEmployeeId(), PayComponentType.IOU_RECOVERY))
        );
    }

    private BigDecimal perPeriod(BigDecimal annual) {
        return annual.divide(BigDecimal.valueOf(settings.getPeriodsPerYear()),
            JournalEntryRequest.CURRENCY_SCALE, RoundingMode.HALF_UP);
    }

    private static void addDebit(List<JournalEntryRequest> group, String account, BigDecimal amount, String memo) {
        if (amount.signum() > 0) {
            group.add(JournalEntryRequest.debit(account, amount, memo));
        }
    }

    private static void addCredit(List<JournalEntryRequest> group, String account, BigDecimal amount, String memo) {
        if (amount.signum() > 0) {
            group.add(JournalEntryRequest.credit(account, amount, memo));
        }
    }

    private static String describe(PayrollRunLine line) {
        return line.getEmployeeName() != null
            ? String.format("%s (%s)", line.getEmployeeName(), line.getEmployeeId())
            : line.getEmployeeId();
    }

    private static final class EmployeeFigures {
        final BigDecimal netPay;
        final BigDecimal tax;
        final BigDecimal pension;
        final BigDecimal housingFund;
        final BigDecimal health;
        final BigDecimal deductions;
        final BigDecimal advanceRecovery;

        EmployeeFigures(BigDecimal netPay, BigDecimal tax, BigDecimal pension, BigDecimal housingFund,
                        BigDecimal health, BigDecimal deductions, BigDecimal advanceRecovery) {
            this.netPay = netPay;
            this.tax = tax;
            this.pension = pension;
            this.housingFund = housingFund;
            this.health = health;
            this.deductions = deductions;
            this.advanceRecovery = advanceRecovery;
        }

        BigDecimal totalCost() {
            return netPay.add(tax).add(pension).add(housingFund).add(health).add(deductions).add(advanceRecovery);
        }
    }
}
