package com.flagship.bookkeeping.report;

import com.flagship.bookkeeping.ledger.AccountCategory;
import lombok.Value;

/**
 * One account's line in the trial balance. Balances are signed on the account's normal side.
 */
@Value
public class TrialBalanceRow {
    Long accountId;
    String code;
    String name;
    AccountCategory category;
    long openingBalance;
    long carryForward;
    long debitTotal;
    long creditTotal;
    long closingBalance;
}
