package com.flagship.payroll_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A journal line whose account has been resolved against the chart of accounts.
 */
@Value
public class PostingLine {
    Account account;
    EntryType entryType;
    BigDecimal amount;
    String memo;

    static PostingLine resolve(JournalEntryRequest request, Account account) {
        return new PostingLine(account, request.getEntryType(), request.getAmount(), request.getMemo());
    }

    /**
     * Effect of this line on the account balance, signed by the account's normal side.
     */
    public BigDecimal getSignedAmount() {
        return account.getAccountType().signedAmount(entryType, amount);
    }
}
