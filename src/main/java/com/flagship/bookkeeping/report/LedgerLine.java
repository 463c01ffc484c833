package com.flagship.bookkeeping.report;

import com.flagship.bookkeeping.ledger.TaxClassification;
import lombok.Value;

import java.time.LocalDate;

/**
 * One journal entry as seen from a single account, with the running balance after it.
 */
@Value
public class LedgerLine {
    Long entryId;
    LocalDate entryDate;
    long debitAmount;
    long creditAmount;
    Long counterAccountId;
    String counterAccount;
    TaxClassification taxClassification;
    String counterparty;
    String memo;
    long balance;
}
