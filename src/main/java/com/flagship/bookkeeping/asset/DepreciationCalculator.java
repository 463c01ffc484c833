package com.flagship.bookkeeping.asset;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Straight-line depreciation with month proration and disposal handling.
 *
 * Pure arithmetic over a {@link FixedAsset}; no I/O. All divisions floor.
 *
 * Per requested fiscal year:
 * - The acquisition year is prorated by (13 - acquisition month) twelfths
 * - Cumulative depreciation never exceeds cost - 1
 * - A disposal in the year prorates to the disposal month and closes the book value at 0
 */
@Component
public class DepreciationCalculator {

    private static final int MONTHS_PER_YEAR = 12;

    /**
     * Computes the row for {@code fiscalYear}.
     *
     * @return empty when the asset is acquired after the year or was disposed in an earlier year
     */
    public Optional<DepreciationRow> compute(FixedAsset asset, int fiscalYear) {
        return row(asset, fiscalYear, cumulativeBefore(asset, fiscalYear));
    }

    /**
     * Every year's row from acquisition until the book value reaches the memorandum value
     * or the disposal year.
     */
    public List<DepreciationRow> lifetimeSchedule(FixedAsset asset) {
        List<DepreciationRow> rows = new ArrayList<>();
        long cumulative = 0;
        int year = asset.acquisitionYear();
        while (true) {
            Optional<DepreciationRow> next = row(asset, year, cumulative);
            if (next.isEmpty()) {
                break;
            }
            DepreciationRow current = next.get();
            rows.add(current);
            if (current.getDisposalType() != null || current.getClosingBookValue() <= 1) {
                break;
            }
            if (current.getDepreciationAmount() == 0 && year > asset.acquisitionYear()) {
                // annual amount of 0 (cost - 1 < useful life) never reaches 1
                break;
            }
            cumulative = asset.getAcquisitionCost() - current.getClosingBookValue();
            year++;
        }
        return rows;
    }

    /**
     * Depreciation recognized in all fiscal years strictly before {@code fiscalYear}.
     */
    long cumulativeBefore(FixedAsset asset, int fiscalYear) {
        long base = asset.depreciableBase();
        long annual = asset.annualAmount();
        long cumulative = 0;
        for (int year = asset.acquisitionYear(); year < fiscalYear && cumulative < base; year++) {
            long amount = year == asset.acquisitionYear()
                ? prorate(annual, MONTHS_PER_YEAR + 1 - asset.acquisitionMonth())
                : annual;
            cumulative += Math.min(amount, base - cumulative);
        }
        return cumulative;
    }

    /**
     * Statutory straight-line rate: 1 / useful life rounded up to three decimals.
     */
    public static BigDecimal annualRate(int usefulLife) {
        return BigDecimal.ONE.divide(BigDecimal.valueOf(usefulLife), 3, RoundingMode.CEILING);
    }

    private Optional<DepreciationRow> row(FixedAsset asset, int fiscalYear, long cumulativeBefore) {
        if (asset.acquisitionYear() > fiscalYear) {
            return Optional.empty();
        }
        boolean disposedThisYear = asset.isDisposed() && asset.getDisposalDate().getYear() == fiscalYear;
        if (asset.isDisposed() && asset.getDisposalDate().getYear() < fiscalYear) {
            return Optional.empty();
        }

        long base = asset.depreciableBase();
        long annual = asset.annualAmount();
        long remaining = base - cumulativeBefore;
        long opening = asset.getAcquisitionCost() - cumulativeBefore;
        boolean acquiredThisYear = asset.acquisitionYear() == fiscalYear;

        DepreciationRow.DepreciationRowBuilder builder = baseRow(asset, fiscalYear);

        if (remaining <= 0 && !disposedThisYear) {
            return Optional.of(builder
                .monthsDepreciated(0)
                .openingBookValue(1)
                .depreciationAmount(0)
                .closingBookValue(1)
                .remark("")
                .build());
        }

        if (disposedThisYear) {
            int disposalMonth = asset.getDisposalDate().getMonthValue();
            int monthsUsed = acquiredThisYear
                ? Math.max(1, disposalMonth - asset.acquisitionMonth() + 1)
                : disposalMonth;
            long depreciation = Math.max(0, Math.min(prorate(annual, monthsUsed), remaining));
            long bookValueAfter = opening - depreciation;

            long gainOrLoss;
            String remark;
            if (asset.getDisposalType() == DisposalType.SALE) {
                long proceeds = asset.getDisposalProceeds() != null ? asset.getDisposalProceeds() : 0L;
                gainOrLoss = proceeds - bookValueAfter;
                remark = String.format("Sold for %d: %s %d", proceeds,
                    gainOrLoss >= 0 ? "gain" : "loss", Math.abs(gainOrLoss));
            } else {
                gainOrLoss = -bookValueAfter;
                remark = bookValueAfter <= 1
                    ? "Retired: already fully depreciated"
                    : String.format("Retired: retirement loss %d", bookValueAfter);
            }
            return Optional.of(builder
                .monthsDepreciated(monthsUsed)
                .openingBookValue(opening)
                .depreciationAmount(depreciation)
                .closingBookValue(0)
                .disposalType(asset.getDisposalType())
                .disposalDate(asset.getDisposalDate())
                .disposalProceeds(asset.getDisposalType() == DisposalType.SALE ? asset.getDisposalProceeds() : null)
                .gainOrLoss(gainOrLoss)
                .remark(remark)
                .build());
        }

        int months = acquiredThisYear ? MONTHS_PER_YEAR + 1 - asset.acquisitionMonth() : MONTHS_PER_YEAR;
        long depreciation = Math.min(prorate(annual, months), remaining);
        return Optional.of(builder
            .monthsDepreciated(months)
            .openingBookValue(opening)
            .depreciationAmount(depreciation)
            .closingBookValue(opening - depreciation)
            .remark("")
            .build());
    }

    private DepreciationRow.DepreciationRowBuilder baseRow(FixedAsset asset, int fiscalYear) {
        return DepreciationRow.builder()
            .assetId(asset.getId())
            .assetName(asset.getName())
            .acquisitionDate(asset.getAcquisitionDate())
            .acquisitionCost(asset.getAcquisitionCost())
            .usefulLife(asset.getUsefulLife())
            .method(asset.getDepreciationMethod())
            .fiscalYear(fiscalYear)
            .annualRate(annualRate(asset.getUsefulLife()))
            .annualAmount(asset.annualAmount());
    }

    private static long prorate(long annual, int months) {
        return Math.multiplyExact(annual, months) / MONTHS_PER_YEAR;
    }
}
