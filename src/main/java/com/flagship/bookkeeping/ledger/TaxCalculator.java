package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.common.exception.ValidationException;

/**
 * Extracts the consumption-tax component from a tax-inclusive amount.
 *
 * tax = amount * rate / (100 + rate), floored. Zero-rated classifications yield 0.
 * The result always satisfies {@code 0 <= tax <= amount}.
 */
public final class TaxCalculator {

    private TaxCalculator() {
        // Utility class
    }

    public static long taxAmount(long amount, TaxClassification classification) {
        if (classification == null) {
            throw new ValidationException("Tax classification is required");
        }
        if (amount < 0) {
            throw new ValidationException("Amount must not be negative: " + amount);
        }
        int rate = classification.getRate();
        if (rate == 0) {
            return 0;
        }
        // Both operands are non-negative, so integer division is floor division
        return Math.multiplyExact(amount, (long) rate) / (100 + rate);
    }
}
