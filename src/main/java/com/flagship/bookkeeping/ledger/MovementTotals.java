package com.flagship.bookkeeping.ledger;

import lombok.Value;

/**
 * Sums of live journal amounts posted to one account, per leg, over some date range.
 */
@Value
public class MovementTotals {

    public static final MovementTotals ZERO = new MovementTotals(0L, 0L);

    long debit;
    long credit;

    public MovementTotals plus(MovementTotals other) {
        return new MovementTotals(debit + other.debit, credit + other.credit);
    }
}
