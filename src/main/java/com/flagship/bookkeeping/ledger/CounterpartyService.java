package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.common.exception.NotFoundException;
import com.flagship.bookkeeping.common.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Counterparty master and the name suggestions built from it.
 *
 * Deleting a counterparty only deactivates it. Journal entries keep their
 * counterparty text, so a deactivated name still appears in {@link #counterpartyNames()}
 * while a live entry uses it.
 */
@Service
@Slf4j
public class CounterpartyService {

    private static final String SELECT_COUNTERPARTY =
        "SELECT id, name, code, contact_info, notes, is_active FROM counterparties";

    private final JdbcTemplate jdbcTemplate;

    public CounterpartyService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Active counterparties ordered by name.
     */
    @Transactional(readOnly = true)
    public List<Counterparty> listCounterparties() {
        return jdbcTemplate.query(SELECT_COUNTERPARTY + " WHERE is_active = TRUE ORDER BY name, id",
            counterpartyRowMapper());
    }

    @Transactional(readOnly = true)
    public Counterparty getCounterparty(long counterpartyId) {
        return jdbcTemplate.query(SELECT_COUNTERPARTY + " WHERE id = ? AND is_active = TRUE",
                counterpartyRowMapper(), counterpartyId)
            .stream()
            .findFirst()
            .orElseThrow(() -> NotFoundException.counterparty(counterpartyId));
    }

    /**
     * Distinct names of active counterparties and of counterparties used by live journal entries,
     * ordered by name.
     */
    @Transactional(readOnly = true)
    public List<String> counterpartyNames() {
        return jdbcTemplate.queryForList(
            "SELECT name FROM counterparties WHERE is_active = TRUE " +
            "UNION " +
            "SELECT counterparty FROM journal_entries WHERE is_deleted = FALSE AND counterparty <> '' " +
            "ORDER BY name",
            String.class
        );
    }

    @Transactional
    public Counterparty createCounterparty(String name, String code, String contactInfo, String notes) {
        String trimmedName = requireName(name);
        Long counterpartyId = jdbcTemplate.queryForObject(
            "INSERT INTO counterparties (name, code, contact_info, notes) VALUES (?, ?, ?, ?) RETURNING id",
            Long.class,
            trimmedName,
            orEmpty(code),
            orEmpty(contactInfo),
            orEmpty(notes)
        );
        log.info("Created counterparty: id={}, name={}", counterpartyId, trimmedName);
        return getCounterparty(counterpartyId);
    }

    /**
     * Replaces all attributes of an active counterparty.
     */
    @Transactional
    public Counterparty updateCounterparty(long counterpartyId, String name, String code,
                                           String contactInfo, String notes) {
        getCounterparty(counterpartyId);
        String trimmedName = requireName(name);
        jdbcTemplate.update(
            "UPDATE counterparties SET name = ?, code = ?, contact_info = ?, notes = ?, " +
            "updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            trimmedName,
            orEmpty(code),
            orEmpty(contactInfo),
            orEmpty(notes),
            counterpartyId
        );
        log.info("Updated counterparty: id={}, name={}", counterpartyId, trimmedName);
        return getCounterparty(counterpartyId);
    }

    @Transactional
    public void deleteCounterparty(long counterpartyId) {
        Counterparty counterparty = getCounterparty(counterpartyId);
        jdbcTemplate.update(
            "UPDATE counterparties SET is_active = FALSE, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            counterpartyId
        );
        log.info("Deactivated counterparty: id={}, name={}", counterpartyId, counterparty.getName());
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Counterparty name is required");
        }
        return name.trim();
    }

    private static String orEmpty(String value) {
        return value != null ? value.trim() : "";
    }

    private static RowMapper<Counterparty> counterpartyRowMapper() {
        return (rs, rowNum) -> new Counterparty(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("code"),
            rs.getString("contact_info"),
            rs.getString("notes"),
            rs.getBoolean("is_active")
        );
    }
}
