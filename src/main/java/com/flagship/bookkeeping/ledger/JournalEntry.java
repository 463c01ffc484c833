package com.flagship.bookkeeping.ledger;

import lombok.Value;

import java.time.LocalDate;

/**
 * A single double-entry transaction: one debit leg, one credit leg, one tax-inclusive amount.
 *
 * Both legs carry the account code and name so rows can be rendered or exported as-is.
 */
@Value
public class JournalEntry {
    Long id;
    LocalDate entryDate;
    Long debitAccountId;
    String debitCode;
    String debitAccount;
    Long creditAccountId;
    String creditCode;
    String creditAccount;
    long amount;
    TaxClassification taxClassification;
    long taxAmount;
    String counterparty;
    String memo;
    String evidenceUrl;
    String source;

    /**
     * Key used to flag imported candidates that duplicate an existing entry.
     */
    public String duplicateKey() {
        return duplicateKey(entryDate, amount, counterparty);
    }

    public static String duplicateKey(LocalDate date, long amount, String counterparty) {
        return date + "_" + amount + "_" + (counterparty != null ? counterparty : "");
    }
}
