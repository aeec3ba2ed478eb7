package com.flagship.payroll_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * An account in the chart of accounts.
 *
 * The account number is the stable identifier that journal requests refer to.
 * Balance-constrained accounts may never be posted into a negative running balance.
 */
@Value
public class Account {
    UUID id;
    String accountNumber;
    String name;
    AccountType accountType;
    boolean balanceConstrained;

    public enum AccountType {
        ASSET,
        LIABILITY,
        EQUITY,
        REVENUE,
        EXPENSE;

        /**
         * ASSET and EXPENSE balances grow with debits; the others grow with credits.
         */
        public boolean isDebitNormal() {
            return this == ASSET || this == EXPENSE;
        }

        /**
         * Signed effect of an entry on a balance of this account type.
         */
        public BigDecimal signedAmount(EntryType entryType, BigDecimal amount) {
            boolean increases = (entryType == EntryType.DEBIT) == isDebitNormal();
            return increases ? amount : amount.negate();
        }
    }
}
