package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.common.exception.NotFoundException;
import com.flagship.bookkeeping.common.exception.ValidationException;
import com.flagship.bookkeeping.ledger.dto.OpeningBalanceRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-(fiscal year, account) opening balances. One row per account per year; saves are upserts.
 */
@Service
@Slf4j
public class OpeningBalanceService {

    static final int MIN_FISCAL_YEAR = 1900;
    static final int MAX_FISCAL_YEAR = 9999;

    private final JdbcTemplate jdbcTemplate;
    private final AccountService accountService;

    public OpeningBalanceService(JdbcTemplate jdbcTemplate, AccountService accountService) {
        this.jdbcTemplate = jdbcTemplate;
        this.accountService = accountService;
    }

    /**
     * Every active account with its opening balance for the year (0 and empty note when none is stored).
     */
    @Transactional(readOnly = true)
    public List<OpeningBalance> listOpeningBalances(int fiscalYear) {
        validateFiscalYear(fiscalYear);
        return jdbcTemplate.query(
            "SELECT a.id AS account_id, a.code, a.name, a.category, " +
            "COALESCE(ob.amount, 0) AS amount, COALESCE(ob.note, '') AS note " +
            "FROM accounts a " +
            "LEFT JOIN opening_balances ob ON a.id = ob.account_id AND ob.fiscal_year = ? " +
            "WHERE a.is_active = TRUE " +
            "ORDER BY a.display_order, a.code",
            (rs, rowNum) -> new OpeningBalance(
                fiscalYear,
                rs.getLong("account_id"),
                rs.getString("code"),
                rs.getString("name"),
                AccountCategory.valueOf(rs.getString("category")),
                rs.getLong("amount"),
                rs.getString("note")
            ),
            fiscalYear
        );
    }

    /**
     * Bulk upsert. The whole save commits or none of it does.
     *
     * @throws NotFoundException if any row names an unknown account
     */
    @Transactional
    public List<OpeningBalance> saveOpeningBalances(int fiscalYear, List<OpeningBalanceRequest> rows) {
        validateFiscalYear(fiscalYear);
        for (OpeningBalanceRequest row : rows) {
            if (row.getAccountId() == null) {
                throw new ValidationException("Account ID is required for every opening balance row");
            }
            accountService.getAccount(row.getAccountId());
            jdbcTemplate.update(
                "INSERT INTO opening_balances (fiscal_year, account_id, amount, note) VALUES (?, ?, ?, ?) " +
                "ON CONFLICT (fiscal_year, account_id) DO UPDATE SET amount = EXCLUDED.amount, note = EXCLUDED.note",
                fiscalYear,
                row.getAccountId(),
                row.getAmount(),
                row.getNote() != null ? row.getNote() : ""
            );
        }
        log.info("Saved {} opening balances for fiscal year {}", rows.size(), fiscalYear);
        return listOpeningBalances(fiscalYear);
    }

    /**
     * Stored opening amounts for the year keyed by account id. Accounts without a row are absent.
     */
    @Transactional(readOnly = true)
    public Map<Long, Long> openingAmounts(int fiscalYear) {
        Map<Long, Long> amounts = new HashMap<>();
        jdbcTemplate.query(
            "SELECT account_id, amount FROM opening_balances WHERE fiscal_year = ?",
            rs -> {
                amounts.put(rs.getLong("account_id"), rs.getLong("amount"));
            },
            fiscalYear
        );
        return amounts;
    }

    @Transactional(readOnly = true)
    public long openingAmount(int fiscalYear, long accountId) {
        return jdbcTemplate.query(
                "SELECT amount FROM opening_balances WHERE fiscal_year = ? AND account_id = ?",
                (rs, rowNum) -> rs.getLong("amount"),
                fiscalYear,
                accountId)
            .stream()
            .findFirst()
            .orElse(0L);
    }

    public static void validateFiscalYear(int fiscalYear) {
        if (fiscalYear < MIN_FISCAL_YEAR || fiscalYear > MAX_FISCAL_YEAR) {
            throw new ValidationException("Fiscal year out of range: " + fiscalYear);
        }
    }
}
