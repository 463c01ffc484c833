package com.flagship.bookkeeping.asset;

import lombok.Value;

import java.time.LocalDate;

/**
 * Fixed-asset domain object.
 *
 * Key rules:
 * - Acquisition cost is at least 1; the last 1 (memorandum value) is never depreciated
 * - Depreciation is straight-line over a whole number of years
 * - A disposal is part of the asset, not a separate record, and can be cancelled
 */
@Value
public class FixedAsset {
    Long id;
    String name;
    LocalDate acquisitionDate;
    int usefulLife;
    long acquisitionCost;
    DepreciationMethod depreciationMethod;
    String notes;
    DisposalType disposalType;
    LocalDate disposalDate;
    Long disposalProceeds;

    public boolean isDisposed() {
        return disposalType != null && disposalDate != null;
    }

    /**
     * Cost less the 1-unit memorandum value.
     */
    public long depreciableBase() {
        return acquisitionCost - 1;
    }

    /**
     * Full-year straight-line amount, floored.
     */
    public long annualAmount() {
        return depreciableBase() / usefulLife;
    }

    public int acquisitionYear() {
        return acquisitionDate.getYear();
    }

    public int acquisitionMonth() {
        return acquisitionDate.getMonthValue();
    }
}
