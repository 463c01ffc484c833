package com.flagship.bookkeeping.ledger;

/**
 * The side on which an account's balance increases.
 *
 * Every balance computation (trial balance, general ledger running balance)
 * goes through {@link #movement(long, long)} so the sign rule lives in one place.
 */
public enum NormalSide {
    DEBIT,
    CREDIT;

    /**
     * Net effect of the given debit and credit totals on a balance kept on this side.
     */
    public long movement(long debit, long credit) {
        return switch (this) {
            case DEBIT -> debit - credit;
            case CREDIT -> credit - debit;
        };
    }

    public long apply(long balance, long debit, long credit) {
        return balance + movement(debit, credit);
    }
}
