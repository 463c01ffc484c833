package com.flagship.bookkeeping.ledger;

import lombok.Value;

/**
 * Starting balance of one account for one fiscal year, on the account's normal side.
 */
@Value
public class OpeningBalance {
    int fiscalYear;
    Long accountId;
    String code;
    String name;
    AccountCategory category;
    long amount;
    String note;
}
