package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.common.exception.AccountInUseException;
import com.flagship.bookkeeping.common.exception.DuplicateAccountException;
import com.flagship.bookkeeping.common.exception.NotFoundException;
import com.flagship.bookkeeping.common.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Account registry: the chart of accounts with category and activation state.
 *
 * Invariants enforced here:
 * 1. Codes and names are unique (DuplicateAccountException)
 * 2. Accounts are only deactivated, and only while no live journal entry references them on either leg
 * 3. The category of a referenced account cannot change, since it fixes the sign of every past balance
 */
@Service
@Slf4j
public class AccountService {

    private static final String SELECT_ACCOUNT =
        "SELECT id, code, name, category, tax_default, display_order, is_active FROM accounts";

    private final JdbcTemplate jdbcTemplate;

    public AccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Lists accounts ordered by display order, then code.
     */
    @Transactional(readOnly = true)
    public List<Account> listAccounts(boolean activeOnly) {
        String sql = SELECT_ACCOUNT
            + (activeOnly ? " WHERE is_active = TRUE" : "")
            + " ORDER BY display_order, code";
        return jdbcTemplate.query(sql, accountRowMapper());
    }

    @Transactional(readOnly = true)
    public Account getAccount(long accountId) {
        return jdbcTemplate.query(SELECT_ACCOUNT + " WHERE id = ?", accountRowMapper(), accountId)
            .stream()
            .findFirst()
            .orElseThrow(() -> NotFoundException.account(accountId));
    }

    @Transactional(readOnly = true)
    public Optional<Account> findActiveByName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return jdbcTemplate.query(SELECT_ACCOUNT + " WHERE name = ? AND is_active = TRUE",
                accountRowMapper(), name.trim())
            .stream()
            .findFirst();
    }

    /**
     * Creates an account. The display order is the numeric value of the code,
     * or 0 when the code is not all digits.
     *
     * @throws DuplicateAccountException if the code or the name is already taken
     */
    @Transactional
    public Account createAccount(String code, String name, AccountCategory category, TaxClassification taxDefault) {
        if (code == null || code.isBlank()) {
            throw new ValidationException("Account code is required");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("Account name is required");
        }
        if (category == null) {
            throw new ValidationException("Account category is required");
        }
        String trimmedCode = code.trim();
        String trimmedName = name.trim();
        TaxClassification classification = taxDefault != null ? taxDefault : TaxClassification.STANDARD;

        assertCodeAvailable(trimmedCode);
        assertNameAvailable(trimmedName, null);

        Long accountId;
        try {
            accountId = jdbcTemplate.queryForObject(
                "INSERT INTO accounts (code, name, category, tax_default, display_order) " +
                "VALUES (?, ?, ?, ?, ?) RETURNING id",
                Long.class,
                trimmedCode,
                trimmedName,
                category.name(),
                classification.getLabel(),
                displayOrderFor(trimmedCode)
            );
        } catch (DuplicateKeyException e) {
            // Lost a race with a concurrent create
            throw new DuplicateAccountException(
                "Account code or name already exists: " + trimmedCode + " / " + trimmedName, e);
        }

        log.info("Created account: id={}, code={}, name={}, category={}", accountId, trimmedCode, trimmedName, category);
        return getAccount(accountId);
    }

    /**
     * Updates the mutable attributes of an account.
     *
     * @throws ValidationException if the category changes while journal entries reference the account
     */
    @Transactional
    public Account updateAccount(long accountId, String name, AccountCategory category,
                                 TaxClassification taxDefault, Integer displayOrder) {
        Account existing = getAccount(accountId);

        String newName = name != null && !name.isBlank() ? name.trim() : existing.getName();
        AccountCategory newCategory = category != null ? category : existing.getCategory();
        TaxClassification newTaxDefault = taxDefault != null ? taxDefault : existing.getTaxDefault();
        int newDisplayOrder = displayOrder != null ? displayOrder : existing.getDisplayOrder();

        if (!newName.equals(existing.getName())) {
            assertNameAvailable(newName, accountId);
        }
        if (newCategory != existing.getCategory()) {
            long references = countReferences(accountId);
            if (references > 0) {
                throw new ValidationException(String.format(
                    "Cannot change category of account %d from %s to %s: referenced by %d journal entries",
                    accountId, existing.getCategory(), newCategory, references));
            }
        }

        try {
            jdbcTemplate.update(
                "UPDATE accounts SET name = ?, category = ?, tax_default = ?, display_order = ?, " +
                "updated_at = CURRENT_TIMESTAMP WHERE id = ?",
                newName,
                newCategory.name(),
                newTaxDefault.getLabel(),
                newDisplayOrder,
                accountId
            );
        } catch (DuplicateKeyException e) {
            throw new DuplicateAccountException("Account name already exists: " + newName, e);
        }

        log.info("Updated account: id={}, name={}, category={}", accountId, newName, newCategory);
        return getAccount(accountId);
    }

    /**
     * Soft-deactivates an account.
     *
     * @throws AccountInUseException if any non-deleted journal entry uses the account as debit or credit leg
     */
    @Transactional
    public void deactivateAccount(long accountId) {
        Account account = getAccount(accountId);

        long references = countReferences(accountId);
        if (references > 0) {
            throw new AccountInUseException(accountId, references);
        }

        jdbcTemplate.update(
            "UPDATE accounts SET is_active = FALSE, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            accountId
        );
        log.info("Deactivated account: id={}, code={}, name={}", accountId, account.getCode(), account.getName());
    }

    /**
     * Counts live journal entries referencing the account on either leg.
     */
    @Transactional(readOnly = true)
    public long countReferences(long accountId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM journal_entries " +
            "WHERE (debit_account_id = ? OR credit_account_id = ?) AND is_deleted = FALSE",
            Long.class,
            accountId,
            accountId
        );
        return count != null ? count : 0L;
    }

    @Transactional(readOnly = true)
    public long countActiveAccounts() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM accounts WHERE is_active = TRUE", Long.class);
        return count != null ? count : 0L;
    }

    private void assertCodeAvailable(String code) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM accounts WHERE code = ?", Integer.class, code);
        if (count != null && count > 0) {
            throw new DuplicateAccountException("Account code already exists: " + code);
        }
    }

    private void assertNameAvailable(String name, Long excludingAccountId) {
        Integer count = excludingAccountId == null
            ? jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM accounts WHERE name = ?", Integer.class, name)
            : jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM accounts WHERE name = ? AND id <> ?", Integer.class, name, excludingAccountId);
        if (count != null && count > 0) {
            throw new DuplicateAccountException("Account name already exists: " + name);
        }
    }

    private static int displayOrderFor(String code) {
        if (!code.chars().allMatch(Character::isDigit)) {
            return 0;
        }
        try {
            return Integer.parseInt(code);
        } catch (NumberFormatException e) {
            // All digits but out of int range
            return 0;
        }
    }

    static RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getLong("id"),
            rs.getString("code"),
            rs.getString("name"),
            AccountCategory.valueOf(rs.getString("category")),
            TaxClassification.fromLabel(rs.getString("tax_default")),
            rs.getInt("display_order"),
            rs.getBoolean("is_active")
        );
    }
}
