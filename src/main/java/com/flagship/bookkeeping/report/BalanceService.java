package com.flagship.bookkeeping.report;

import com.flagship.bookkeeping.ledger.Account;
import com.flagship.bookkeeping.ledger.AccountService;
import com.flagship.bookkeeping.ledger.JournalEntry;
import com.flagship.bookkeeping.ledger.JournalService;
import com.flagship.bookkeeping.ledger.MovementTotals;
import com.flagship.bookkeeping.ledger.NormalSide;
import com.flagship.bookkeeping.ledger.OpeningBalanceService;
import com.flagship.bookkeeping.observability.BookkeepingMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Balance calculator: trial balance (all active accounts, one window) and
 * general ledger (one account, running balance).
 *
 * Balances are derived from journal movement and stored opening balances, never stored.
 * For every account:
 *   carry_forward = opening + movement(fiscal year start .. day before window start)
 *   closing       = carry_forward + movement(window)
 * where movement is signed by the account's {@link NormalSide}.
 *
 * Each report runs in one repeatable-read transaction so all of its queries see the same snapshot.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceService {

    private final AccountService accountService;
    private final JournalService journalService;
    private final OpeningBalanceService openingBalanceService;
    private final BookkeepingMetrics metrics;
    private final Clock clock;

    /**
     * Trial balance of every active account, in registry order. Zero-activity accounts are included.
     *
     * @param startDate window start, January 1 when null
     * @param endDate   window end, December 31 when null
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public List<TrialBalanceRow> trialBalance(int fiscalYear, LocalDate startDate, LocalDate endDate) {
        FiscalPeriod period = FiscalPeriod.of(fiscalYear, startDate, endDate);
        return metrics.timeReport(BookkeepingMetrics.REPORT_TRIAL_BALANCE, () -> computeTrialBalance(period));
    }

    /**
     * General ledger of one account. The fiscal year is the year of the start date,
     * else of the end date, else the current year.
     *
     * @throws com.flagship.bookkeeping.common.exception.NotFoundException if the account does not exist
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public GeneralLedger generalLedger(long accountId, LocalDate startDate, LocalDate endDate) {
        Account account = accountService.getAccount(accountId);
        int fiscalYear = startDate != null ? startDate.getYear()
            : endDate != null ? endDate.getYear()
            : LocalDate.now(clock).getYear();
        FiscalPeriod period = FiscalPeriod.of(fiscalYear, startDate, endDate);
        return metrics.timeReport(BookkeepingMetrics.REPORT_GENERAL_LEDGER, () -> computeLedger(account, period));
    }

    private List<TrialBalanceRow> computeTrialBalance(FiscalPeriod period) {
        List<Account> accounts = accountService.listAccounts(true);
        Map<Long, Long> openings = openingBalanceService.openingAmounts(period.getFiscalYear());
        Map<Long, MovementTotals> inWindow =
            journalService.movementTotalsByAccount(period.getStartDate(), period.getEndDate());
        Map<Long, MovementTotals> beforeWindow =
            journalService.movementTotalsByAccount(period.yearStart(), period.carryForwardEnd());

        List<TrialBalanceRow> rows = new ArrayList<>(accounts.size());
        for (Account account : accounts) {
            NormalSide side = account.normalSide();
            long opening = openings.getOrDefault(account.getId(), 0L);
            MovementTotals before = beforeWindow.getOrDefault(account.getId(), MovementTotals.ZERO);
            MovementTotals during = inWindow.getOrDefault(account.getId(), MovementTotals.ZERO);

            long carryForward = side.apply(opening, before.getDebit(), before.getCredit());
            long closing = side.apply(carryForward, during.getDebit(), during.getCredit());

            rows.add(new TrialBalanceRow(
                account.getId(),
                account.getCode(),
                account.getName(),
                account.getCategory(),
                opening,
                carryForward,
                during.getDebit(),
                during.getCredit(),
                closing
            ));
        }

        log.debug("Trial balance for {}..{}: {} accounts", period.getStartDate(), period.getEndDate(), rows.size());
        return rows;
    }

    private GeneralLedger computeLedger(Account account, FiscalPeriod period) {
        long accountId = account.getId();
        NormalSide side = account.normalSide();

        long opening = openingBalanceService.openingAmount(period.getFiscalYear(), accountId);
        MovementTotals before = journalService.movementTotals(accountId, period.yearStart(), period.carryForwardEnd());
        long carryForward = side.apply(opening, before.getDebit(), before.getCredit());

        List<JournalEntry> entries =
            journalService.entriesForAccount(accountId, period.getStartDate(), period.getEndDate());

        List<LedgerLine> lines = new ArrayList<>(entries.size());
        long balance = carryForward;
        long debitTotal = 0;
        long creditTotal = 0;
        for (JournalEntry entry : entries) {
            boolean debitLeg = entry.getDebitAccountId() == accountId;
            long debitAmount = debitLeg ? entry.getAmount() : 0L;
            long creditAmount = debitLeg ? 0L : entry.getAmount();

            balance = side.apply(balance, debitAmount, creditAmount);
            debitTotal += debitAmount;
            creditTotal += creditAmount;

            lines.add(new LedgerLine(
                entry.getId(),
                entry.getEntryDate(),
                debitAmount,
                creditAmount,
                debitLeg ? entry.getCreditAccountId() : entry.getDebitAccountId(),
                debitLeg ? entry.getCreditAccount() : entry.getDebitAccount(),
                entry.getTaxClassification(),
                entry.getCounterparty(),
                entry.getMemo(),
                balance
            ));
        }

        log.debug("General ledger for account {} ({}..{}): {} lines",
            accountId, period.getStartDate(), period.getEndDate(), lines.size());
        return new GeneralLedger(
            account,
            period.getFiscalYear(),
            period.getStartDate(),
            period.getEndDate(),
            opening,
            carryForward,
            debitTotal,
            creditTotal,
            balance,
            lines
        );
    }
}
