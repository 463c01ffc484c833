package com.flagship.bookkeeping.asset;

/**
 * Depreciation methods known to the register. Only straight-line is computed.
 */
public enum DepreciationMethod {
    STRAIGHT_LINE
}
