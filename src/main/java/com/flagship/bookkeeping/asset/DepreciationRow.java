package com.flagship.bookkeeping.asset;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One asset's depreciation figures for one fiscal year.
 * Disposal fields and gain/loss are null unless the disposal falls in that year.
 */
@Value
@Builder
public class DepreciationRow {
    Long assetId;
    String assetName;
    LocalDate acquisitionDate;
    long acquisitionCost;
    int usefulLife;
    DepreciationMethod method;
    int fiscalYear;
    BigDecimal annualRate;
    long annualAmount;
    int monthsDepreciated;
    long openingBookValue;
    long depreciationAmount;
    long closingBookValue;
    DisposalType disposalType;
    LocalDate disposalDate;
    Long disposalProceeds;
    Long gainOrLoss;
    String remark;
}
