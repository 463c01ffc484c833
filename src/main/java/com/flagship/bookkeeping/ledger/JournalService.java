package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.common.exception.NotFoundException;
import com.flagship.bookkeeping.common.exception.ValidationException;
import com.flagship.bookkeeping.config.BookkeepingProperties;
import com.flagship.bookkeeping.observability.BookkeepingMetrics;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Journal store accessor: append, update and soft-delete of double-entry records,
 * plus the read paths the balance reports are built on.
 *
 * This service enforces:
 * 1. Amounts are positive and tax-inclusive
 * 2. The debit and credit legs are two different active accounts
 * 3. tax_amount is always derived from (amount, classification), never taken from the caller
 * 4. Deleted entries are flagged, never removed, and are invisible to every read
 */
@Service
@Slf4j
public class JournalService {

    static final String DEFAULT_SOURCE = "manual";

    /** Largest accepted amount; keeps {@code amount * rate} inside a long for every tax rate. */
    public static final long MAX_AMOUNT = 999_999_999_999_999L;

    private static final String SELECT_ENTRY =
        "SELECT je.id, je.entry_date, je.amount, je.tax_classification, je.tax_amount, " +
        "je.counterparty, je.memo, je.evidence_url, je.source, " +
        "je.debit_account_id, da.code AS debit_code, da.name AS debit_account, " +
        "je.credit_account_id, ca.code AS credit_code, ca.name AS credit_account " +
        "FROM journal_entries je " +
        "JOIN accounts da ON je.debit_account_id = da.id " +
        "JOIN accounts ca ON je.credit_account_id = ca.id ";

    private final JdbcTemplate jdbcTemplate;
    private final AccountResolver accountResolver;
    private final BookkeepingProperties properties;
    private final BookkeepingMetrics metrics;

    public JournalService(JdbcTemplate jdbcTemplate, AccountResolver accountResolver,
                          BookkeepingProperties properties, BookkeepingMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.accountResolver = accountResolver;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Creates a single journal entry in its own transaction.
     *
     * @return the stored entry
     * @throws ValidationException if the request is malformed or a leg cannot be resolved
     */
    @Transactional
    public JournalEntry createEntry(JournalEntryRequest request) {
        PreparedEntry entry = prepare(request);

        Long entryId = jdbcTemplate.queryForObject(
            "INSERT INTO journal_entries " +
            "(entry_date, debit_account_id, credit_account_id, amount, tax_classification, tax_amount, " +
            " counterparty, memo, evidence_url, source) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?) RETURNING id",
            Long.class,
            entry.getEntryDate(),
            entry.getDebit().getId(),
            entry.getCredit().getId(),
            entry.getAmount(),
            entry.getTaxClassification().getLabel(),
            entry.getTaxAmount(),
            entry.getCounterparty(),
            entry.getMemo(),
            entry.getEvidenceUrl(),
            entry.getSource()
        );

        metrics.recordEntryCreated(entry.getSource());
        log.info("Created journal entry: id={}, date={}, debit={}, credit={}, amount={}, source={}",
            entryId, entry.getEntryDate(), entry.getDebit().getName(), entry.getCredit().getName(),
            entry.getAmount(), entry.getSource());
        return getEntry(entryId);
    }

    /**
     * Replaces the contents of a live entry. Accounts are re-resolved and the tax amount recomputed.
     *
     * @throws NotFoundException if the entry does not exist or is deleted
     */
    @Transactional
    public JournalEntry updateEntry(long entryId, JournalEntryRequest request) {
        PreparedEntry entry = prepare(request);

        int updated = jdbcTemplate.update(
            "UPDATE journal_entries SET entry_date = ?, debit_account_id = ?, credit_account_id = ?, " +
            "amount = ?, tax_classification = ?, tax_amount = ?, counterparty = ?, memo = ?, " +
            "evidence_url = ?, source = ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND is_deleted = FALSE",
            entry.getEntryDate(),
            entry.getDebit().getId(),
            entry.getCredit().getId(),
            entry.getAmount(),
            entry.getTaxClassification().getLabel(),
            entry.getTaxAmount(),
            entry.getCounterparty(),
            entry.getMemo(),
            entry.getEvidenceUrl(),
            entry.getSource(),
            entryId
        );
        if (updated == 0) {
            throw NotFoundException.journalEntry(entryId);
        }

        log.info("Updated journal entry: id={}, amount={}", entryId, entry.getAmount());
        return getEntry(entryId);
    }

    /**
     * Soft-deletes an entry.
     *
     * @throws NotFoundException if the entry does not exist or is already deleted
     */
    @Transactional
    public void deleteEntry(long entryId) {
        int updated = jdbcTemplate.update(
            "UPDATE journal_entries SET is_deleted = TRUE, updated_at = CURRENT_TIMESTAMP " +
            "WHERE id = ? AND is_deleted = FALSE",
            entryId
        );
        if (updated == 0) {
            throw NotFoundException.journalEntry(entryId);
        }
        log.info("Deleted journal entry: id={}", entryId);
    }

    @Transactional(readOnly = true)
    public JournalEntry getEntry(long entryId) {
        return jdbcTemplate.query(SELECT_ENTRY + "WHERE je.id = ? AND je.is_deleted = FALSE",
                journalEntryRowMapper(), entryId)
            .stream()
            .findFirst()
            .orElseThrow(() -> NotFoundException.journalEntry(entryId));
    }

    /**
     * Lists live entries matching the query, newest first (date desc, id desc).
     */
    @Transactional(readOnly = true)
    public JournalPage listEntries(JournalQuery query) {
        List<String> conditions = new ArrayList<>();
        List<Object> params = new ArrayList<>();
        conditions.add("je.is_deleted = FALSE");

        if (query.getStartDate() != null) {
            conditions.add("je.entry_date >= ?");
            params.add(query.getStartDate());
        }
        if (query.getEndDate() != null) {
            conditions.add("je.entry_date <= ?");
            params.add(query.getEndDate());
        }
        if (query.getAccountId() != null) {
            conditions.add("(je.debit_account_id = ? OR je.credit_account_id = ?)");
            params.add(query.getAccountId());
            params.add(query.getAccountId());
        }
        if (query.getCounterparty() != null && !query.getCounterparty().isBlank()) {
            conditions.add("je.counterparty LIKE ?");
            params.add("%" + query.getCounterparty().trim() + "%");
        }
        if (query.getMemo() != null && !query.getMemo().isBlank()) {
            conditions.add("je.memo LIKE ?");
            params.add("%" + query.getMemo().trim() + "%");
        }
        String where = "WHERE " + String.join(" AND ", conditions) + " ";

        Long total = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM journal_entries je " + where, Long.class, params.toArray());

        BookkeepingProperties.Journal config = properties.getJournal();
        int page = Math.max(1, query.getPage() != null ? query.getPage() : 1);
        int requested = query.getPerPage() != null ? query.getPerPage() : config.getDefaultPageSize();
        int perPage = Math.min(config.getMaxPageSize(), Math.max(1, requested));
        long offset = (long) (page - 1) * perPage;

        List<Object> pageParams = new ArrayList<>(params);
        pageParams.add(perPage);
        pageParams.add(offset);
        List<JournalEntry> entries = jdbcTemplate.query(
            SELECT_ENTRY + where + "ORDER BY je.entry_date DESC, je.id DESC LIMIT ? OFFSET ?",
            journalEntryRowMapper(),
            pageParams.toArray()
        );

        return new JournalPage(entries, total != null ? total : 0L, page, perPage);
    }

    /**
     * Most recently created live entries.
     */
    @Transactional(readOnly = true)
    public List<JournalEntry> recentEntries(Integer limit) {
        int effective = limit != null && limit > 0
            ? Math.min(limit, properties.getJournal().getMaxPageSize())
            : properties.getJournal().getRecentLimit();
        return jdbcTemplate.query(
            SELECT_ENTRY + "WHERE je.is_deleted = FALSE ORDER BY je.id DESC LIMIT ?",
            journalEntryRowMapper(),
            effective
        );
    }

    /**
     * All live entries in the (optional) window, oldest first, unpaginated.
     */
    @Transactional(readOnly = true)
    public List<JournalEntry> exportEntries(LocalDate startDate, LocalDate endDate) {
        List<Object> params = new ArrayList<>();
        StringBuilder where = new StringBuilder("WHERE je.is_deleted = FALSE ");
        if (startDate != null) {
            where.append("AND je.entry_date >= ? ");
            params.add(startDate);
        }
        if (endDate != null) {
            where.append("AND je.entry_date <= ? ");
            params.add(endDate);
        }
        return jdbcTemplate.query(
            SELECT_ENTRY + where + "ORDER BY je.entry_date ASC, je.id ASC",
            journalEntryRowMapper(),
            params.toArray()
        );
    }

    /**
     * Keys ({@code date_amount_counterparty}) of all live entries, for flagging duplicate candidates.
     */
    @Transactional(readOnly = true)
    public Set<String> existingEntryKeys() {
        Set<String> keys = new HashSet<>();
        jdbcTemplate.query(
            "SELECT entry_date, amount, counterparty FROM journal_entries WHERE is_deleted = FALSE",
            rs -> {
                keys.add(JournalEntry.duplicateKey(
                    rs.getObject("entry_date", LocalDate.class),
                    rs.getLong("amount"),
                    rs.getString("counterparty")));
            }
        );
        return keys;
    }

    /**
     * Debit-leg and credit-leg totals of live entries per account, both bounds inclusive.
     * An empty range yields an empty map.
     */
    @Transactional(readOnly = true)
    public Map<Long, MovementTotals> movementTotalsByAccount(LocalDate fromInclusive, LocalDate toInclusive) {
        Map<Long, MovementTotals> totals = new HashMap<>();
        if (fromInclusive.isAfter(toInclusive)) {
            return totals;
        }
        jdbcTemplate.query(
            "SELECT account_id, SUM(debit) AS debit_total, SUM(credit) AS credit_total FROM (" +
            "  SELECT debit_account_id AS account_id, amount AS debit, 0 AS credit FROM journal_entries " +
            "  WHERE is_deleted = FALSE AND entry_date >= ? AND entry_date <= ? " +
            "  UNION ALL " +
            "  SELECT credit_account_id AS account_id, 0 AS debit, amount AS credit FROM journal_entries " +
            "  WHERE is_deleted = FALSE AND entry_date >= ? AND entry_date <= ? " +
            ") movements GROUP BY account_id",
            rs -> {
                totals.put(rs.getLong("account_id"),
                    new MovementTotals(rs.getLong("debit_total"), rs.getLong("credit_total")));
            },
            fromInclusive, toInclusive, fromInclusive, toInclusive
        );
        return totals;
    }

    /**
     * Debit-leg and credit-leg totals of live entries for one account, both bounds inclusive.
     */
    @Transactional(readOnly = true)
    public MovementTotals movementTotals(long accountId, LocalDate fromInclusive, LocalDate toInclusive) {
        if (fromInclusive.isAfter(toInclusive)) {
            return MovementTotals.ZERO;
        }
        return jdbcTemplate.queryForObject(
            "SELECT " +
            "  COALESCE(SUM(CASE WHEN debit_account_id = ? THEN amount ELSE 0 END), 0) AS debit_total, " +
            "  COALESCE(SUM(CASE WHEN credit_account_id = ? THEN amount ELSE 0 END), 0) AS credit_total " +
            "FROM journal_entries " +
            "WHERE is_deleted = FALSE AND (debit_account_id = ? OR credit_account_id = ?) " +
            "AND entry_date >= ? AND entry_date <= ?",
            (rs, rowNum) -> new MovementTotals(rs.getLong("debit_total"), rs.getLong("credit_total")),
            accountId, accountId, accountId, accountId, fromInclusive, toInclusive
        );
    }

    /**
     * Live entries touching the account on either leg, in chronological order.
     * Same-day entries are ordered by id so the running balance is reproducible.
     */
    @Transactional(readOnly = true)
    public List<JournalEntry> entriesForAccount(long accountId, LocalDate fromInclusive, LocalDate toInclusive) {
        return jdbcTemplate.query(
            SELECT_ENTRY +
            "WHERE je.is_deleted = FALSE AND (je.debit_account_id = ? OR je.credit_account_id = ?) " +
            "AND je.entry_date >= ? AND je.entry_date <= ? " +
            "ORDER BY je.entry_date ASC, je.id ASC",
            journalEntryRowMapper(),
            accountId, accountId, fromInclusive, toInclusive
        );
    }

    private PreparedEntry prepare(JournalEntryRequest request) {
        if (request == null) {
            throw new ValidationException("Journal entry is required");
        }
        LocalDate entryDate = parseDate(request.getEntryDate());

        Long amount = request.getAmount();
        if (amount == null || amount <= 0) {
            throw new ValidationException("Amount must be positive: " + amount);
        }
        if (amount > MAX_AMOUNT) {
            throw new ValidationException("Amount exceeds the maximum of " + MAX_AMOUNT + ": " + amount);
        }

        String classificationLabel = request.getTaxClassification() != null && !request.getTaxClassification().isBlank()
            ? request.getTaxClassification()
            : properties.getJournal().getDefaultTaxClassification();
        TaxClassification classification = TaxClassification.fromLabel(classificationLabel);

        Account debit = accountResolver.resolve("debit", request.getDebitAccountId(), request.getDebitAccount());
        Account credit = accountResolver.resolve("credit", request.getCreditAccountId(), request.getCreditAccount());
        if (debit.getId().equals(credit.getId())) {
            throw new ValidationException("Debit and credit accounts must differ: " + debit.getName());
        }

        return new PreparedEntry(
            entryDate,
            debit,
            credit,
            amount,
            classification,
            TaxCalculator.taxAmount(amount, classification),
            nullToEmpty(request.getCounterparty()),
            nullToEmpty(request.getMemo()),
            nullToEmpty(request.getEvidenceUrl()),
            request.getSource() != null && !request.getSource().isBlank() ? request.getSource().trim() : DEFAULT_SOURCE
        );
    }

    private static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Entry date is required");
        }
        try {
            // Recognition output sometimes uses slashes (2025/03/31)
            return LocalDate.parse(value.trim().replace('/', '-'));
        } catch (DateTimeParseException e) {
            throw new ValidationException("Malformed entry date: " + value, e);
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value.trim() : "";
    }

    static RowMapper<JournalEntry> journalEntryRowMapper() {
        return (rs, rowNum) -> new JournalEntry(
            rs.getLong("id"),
            rs.getObject("entry_date", LocalDate.class),
            rs.getLong("debit_account_id"),
            rs.getString("debit_code"),
            rs.getString("debit_account"),
            rs.getLong("credit_account_id"),
            rs.getString("credit_code"),
            rs.getString("credit_account"),
            rs.getLong("amount"),
            TaxClassification.fromLabel(rs.getString("tax_classification")),
            rs.getLong("tax_amount"),
            rs.getString("counterparty"),
            rs.getString("memo"),
            rs.getString("evidence_url"),
            rs.getString("source")
        );
    }

    /**
     * A request after validation and account resolution, ready to be written.
     */
    @Value
    private static class PreparedEntry {
        LocalDate entryDate;
        Account debit;
        Account credit;
        long amount;
        TaxClassification taxClassification;
        long taxAmount;
        String counterparty;
        String memo;
        String evidenceUrl;
        String source;
    }
}
