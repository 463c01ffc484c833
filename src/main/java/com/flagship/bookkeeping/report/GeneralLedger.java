package com.flagship.bookkeeping.report;

import com.flagship.bookkeeping.ledger.Account;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

/**
 * General ledger of one account over a window of one fiscal year.
 *
 * The running balance starts at {@code carryForward}: the fiscal-year opening balance
 * plus all movement before {@code startDate}. The last line's balance equals
 * {@code closingBalance}, which matches the trial balance for the same window.
 */
@Value
public class GeneralLedger {
    Account account;
    int fiscalYear;
    LocalDate startDate;
    LocalDate endDate;
    long openingBalance;
    long carryForward;
    long debitTotal;
    long creditTotal;
    long closingBalance;
    List<LedgerLine> entries;
}
