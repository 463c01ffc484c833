package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.common.exception.NotFoundException;
import com.flagship.bookkeeping.common.exception.ValidationException;
import com.flagship.bookkeeping.config.BookkeepingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves a journal leg, given by account id or by account name, to an active account.
 *
 * An unrecognised name falls back to the configured default account
 * (miscellaneous expense) when one is configured and active.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccountResolver {

    private final AccountService accountService;
    private final BookkeepingProperties properties;

    /**
     * @param leg "debit" or "credit", used in error messages
     * @throws ValidationException if the leg cannot be resolved
     */
    public Account resolve(String leg, Long accountId, String accountName) {
        if (accountId != null) {
            Account account;
            try {
                account = accountService.getAccount(accountId);
            } catch (NotFoundException e) {
                throw new ValidationException("Unknown " + leg + " account id: " + accountId, e);
            }
            if (!account.isActive()) {
                throw new ValidationException("Inactive " + leg + " account: " + account.getName());
            }
            return account;
        }

        if (accountName == null || accountName.isBlank()) {
            throw new ValidationException("The " + leg + " account is required");
        }

        Optional<Account> byName = accountService.findActiveByName(accountName);
        if (byName.isPresent()) {
            return byName.get();
        }

        BookkeepingProperties.Journal journal = properties.getJournal();
        if (!journal.hasFallbackAccount()) {
            throw new ValidationException("Unknown " + leg + " account: " + accountName);
        }
        Account fallback = accountService.findActiveByName(journal.getFallbackAccountName())
            .orElseThrow(() -> new ValidationException(String.format(
                "Unknown %s account: %s (fallback account '%s' is not available)",
                leg, accountName, journal.getFallbackAccountName())));

        log.info("Unknown {} account '{}' resolved to fallback account '{}'", leg, accountName, fallback.getName());
        return fallback;
    }
}
