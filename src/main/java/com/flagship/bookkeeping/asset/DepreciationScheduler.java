package com.flagship.bookkeeping.asset;

import com.flagship.bookkeeping.ledger.OpeningBalanceService;
import com.flagship.bookkeeping.observability.BookkeepingMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Builds depreciation schedules from the register. Reads no journal data.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DepreciationScheduler {

    private final FixedAssetService fixedAssetService;
    private final DepreciationCalculator calculator;
    private final BookkeepingMetrics metrics;

    /**
     * One row per asset that is on the books during {@code fiscalYear}.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public List<DepreciationRow> compute(int fiscalYear) {
        OpeningBalanceService.validateFiscalYear(fiscalYear);
        return metrics.timeReport(BookkeepingMetrics.REPORT_DEPRECIATION, () -> {
            List<DepreciationRow> rows = fixedAssetService.listAssets().stream()
                .map(asset -> calculator.compute(asset, fiscalYear))
                .flatMap(Optional::stream)
                .toList();
            log.debug("Depreciation schedule for {}: {} rows", fiscalYear, rows.size());
            return rows;
        });
    }

    @Transactional(readOnly = true)
    public List<DepreciationRow> lifetimeSchedule(long assetId) {
        return calculator.lifetimeSchedule(fixedAssetService.getAsset(assetId));
    }
}
