package com.flagship.bookkeeping.ledger;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A journal entry to create or update, as entered by hand or produced by
 * document/statement recognition.
 *
 * Each leg is given either by account id or by account name. Dates and the tax
 * classification arrive as text and are validated by the journal service, so a
 * malformed candidate fails on its own without failing its batch.
 * A tax amount supplied by the caller is never accepted: it is always recomputed.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class JournalEntryRequest {

    @JsonAlias("date")
    String entryDate;

    Long debitAccountId;

    @JsonAlias("debit_account_name")
    String debitAccount;

    Long creditAccountId;

    @JsonAlias("credit_account_name")
    String creditAccount;

    Long amount;

    String taxClassification;

    String counterparty;

    String memo;

    String evidenceUrl;

    String source;
}
