package com.flagship.bookkeeping.ledger;

/**
 * Account category. Determines the normal balance side:
 * assets and expenses increase on the debit side,
 * liabilities, equity and revenue on the credit side.
 */
public enum AccountCategory {
    ASSET(NormalSide.DEBIT),
    LIABILITY(NormalSide.CREDIT),
    EQUITY(NormalSide.CREDIT),
    REVENUE(NormalSide.CREDIT),
    EXPENSE(NormalSide.DEBIT);

    private final NormalSide normalSide;

    AccountCategory(NormalSide normalSide) {
        this.normalSide = normalSide;
    }

    public NormalSide getNormalSide() {
        return normalSide;
    }
}
