package com.flagship.bookkeeping.asset;

/**
 * How a fixed asset left the books.
 */
public enum DisposalType {
    /**
     * Scrapped or removed with no proceeds. The remaining book value is a loss.
     */
    RETIREMENT,

    /**
     * Sold. Proceeds minus book value after prorated depreciation is a gain or loss.
     */
    SALE
}
