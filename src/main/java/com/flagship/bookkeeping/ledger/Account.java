package com.flagship.bookkeeping.ledger;

import lombok.Value;

/**
 * An entry in the chart of accounts.
 *
 * The code is the display/sort key and is unique, as is the name.
 * Accounts are deactivated, never deleted.
 */
@Value
public class Account {
    Long id;
    String code;
    String name;
    AccountCategory category;
    TaxClassification taxDefault;
    int displayOrder;
    boolean active;

    public NormalSide normalSide() {
        return category.getNormalSide();
    }
}
