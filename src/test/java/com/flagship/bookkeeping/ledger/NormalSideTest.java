package com.flagship.bookkeeping.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NormalSideTest {

    @Test
    @DisplayName("Assets and expenses are debit-normal, the rest credit-normal")
    void testCategorySides() {
        assertEquals(NormalSide.DEBIT, AccountCategory.ASSET.getNormalSide());
        assertEquals(NormalSide.DEBIT, AccountCategory.EXPENSE.getNormalSide());
        assertEquals(NormalSide.CREDIT, AccountCategory.LIABILITY.getNormalSide());
        assertEquals(NormalSide.CREDIT, AccountCategory.EQUITY.getNormalSide());
        assertEquals(NormalSide.CREDIT, AccountCategory.REVENUE.getNormalSide());
    }

    @Test
    @DisplayName("Debit side grows with debits, credit side with credits")
    void testApply() {
        // Given: opening 1000, debits 300, credits 500
        // Then: debit-normal 1000 + 300 - 500, credit-normal 1000 + 500 - 300
        assertEquals(800, NormalSide.DEBIT.apply(1000, 300, 500));
        assertEquals(1200, NormalSide.CREDIT.apply(1000, 300, 500));
        assertEquals(-200, NormalSide.DEBIT.movement(300, 500));
        assertEquals(200, NormalSide.CREDIT.movement(300, 500));
    }
}
