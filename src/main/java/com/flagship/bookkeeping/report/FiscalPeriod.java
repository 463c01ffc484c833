package com.flagship.bookkeeping.report;

import com.flagship.bookkeeping.common.exception.ValidationException;
import com.flagship.bookkeeping.ledger.OpeningBalanceService;
import lombok.Value;

import java.time.LocalDate;
import java.time.Month;

/**
 * A reporting window inside one calendar fiscal year.
 *
 * An omitted start means January 1 and an omitted end means December 31.
 * Movement between the start of the year and the start of the window is carried forward.
 */
@Value
public class FiscalPeriod {
    int fiscalYear;
    LocalDate startDate;
    LocalDate endDate;

    /**
     * @throws ValidationException if the window is inverted or leaves the fiscal year
     */
    public static FiscalPeriod of(int fiscalYear, LocalDate startDate, LocalDate endDate) {
        OpeningBalanceService.validateFiscalYear(fiscalYear);
        LocalDate start = startDate != null ? startDate : LocalDate.of(fiscalYear, Month.JANUARY, 1);
        LocalDate end = endDate != null ? endDate : LocalDate.of(fiscalYear, Month.DECEMBER, 31);

        if (start.getYear() != fiscalYear || end.getYear() != fiscalYear) {
            throw new ValidationException(String.format(
                "Window %s..%s lies outside fiscal year %d", start, end, fiscalYear));
        }
        if (start.isAfter(end)) {
            throw new ValidationException(String.format("Start date %s is after end date %s", start, end));
        }
        return new FiscalPeriod(fiscalYear, start, end);
    }

    public LocalDate yearStart() {
        return LocalDate.of(fiscalYear, Month.JANUARY, 1);
    }

    /**
     * Last day carried forward into the window. Before {@link #yearStart()} when the window starts on January 1.
     */
    public LocalDate carryForwardEnd() {
        return startDate.minusDays(1);
    }
}
