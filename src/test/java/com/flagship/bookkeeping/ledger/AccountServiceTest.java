package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.common.exception.AccountInUseException;
import com.flagship.bookkeeping.common.exception.DuplicateAccountException;
import com.flagship.bookkeeping.common.exception.NotFoundException;
import com.flagship.bookkeeping.common.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Chart of accounts: uniqueness, deactivation guard and category immutability.
 */
@SpringBootTest
@Testcontainers
class AccountServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_bookkeeping")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private AccountService accountService;

    @Autowired
    private JournalService journalService;

    private String suffix;

    @BeforeEach
    void setUp() {
        suffix = UUID.randomUUID().toString().substring(0, 8);
    }

    private Account newAccount(String label, AccountCategory category) {
        return accountService.createAccount(
            "T" + label.charAt(0) + suffix, label + " " + suffix, category, TaxClassification.OUT_OF_SCOPE);
    }

    @Test
    @DisplayName("Default chart of accounts is seeded")
    void testSeededChart() {
        assertTrue(accountService.countActiveAccounts() > 0);
        Account misc = accountService.findActiveByName("Miscellaneous Expense").orElseThrow();
        assertEquals(AccountCategory.EXPENSE, misc.getCategory());
        assertEquals(NormalSide.DEBIT, misc.normalSide());
    }

    @Test
    @DisplayName("Created account is listed and keeps its attributes")
    void testCreateAccount() {
        // Given: A new liability account
        Account created = newAccount("Loan", AccountCategory.LIABILITY);

        // Then: It can be fetched and is active
        Account fetched = accountService.getAccount(created.getId());
        assertEquals("Loan " + suffix, fetched.getName());
        assertEquals(AccountCategory.LIABILITY, fetched.getCategory());
        assertEquals(TaxClassification.OUT_OF_SCOPE, fetched.getTaxDefault());
        assertTrue(fetched.isActive());
        assertTrue(accountService.listAccounts(true).stream().anyMatch(a -> a.getId().equals(created.getId())));
    }

    @Test
    @DisplayName("Duplicate code or name is rejected")
    void testDuplicateAccount() {
        Account created = newAccount("Cash", AccountCategory.ASSET);

        assertThrows(DuplicateAccountException.class, () ->
            accountService.createAccount(created.getCode(), "Other " + suffix, AccountCategory.ASSET, null));
        assertThrows(DuplicateAccountException.class, () ->
            accountService.createAccount("X" + suffix, created.getName(), AccountCategory.ASSET, null));
    }

    @Test
    @DisplayName("Missing fields are validation errors")
    void testCreateValidation() {
        assertThrows(ValidationException.class, () ->
            accountService.createAccount(" ", "Name " + suffix, AccountCategory.ASSET, null));
        assertThrows(ValidationException.class, () ->
            accountService.createAccount("C" + suffix, "Name " + suffix, null, null));
    }

    @Test
    @DisplayName("Account in use cannot be deactivated until its entries are deleted")
    void testDeactivationGuard() {
        // Given: An account with one journal entry against it
        Account cash = newAccount("Cash", AccountCategory.ASSET);
        Account sales = newAccount("Sales", AccountCategory.REVENUE);
        JournalEntry entry = journalService.createEntry(JournalEntryRequest.builder()
            .entryDate("2024-06-01")
            .debitAccountId(cash.getId())
            .creditAccountId(sales.getId())
            .amount(5000L)
            .taxClassification("10%")
            .build());

        // When: Deactivation is attempted
        AccountInUseException inUse = assertThrows(AccountInUseException.class,
            () -> accountService.deactivateAccount(sales.getId()));

        // Then: It is blocked and reports the reference count
        assertEquals(1, inUse.getReferenceCount());
        assertTrue(accountService.getAccount(sales.getId()).isActive());

        // When: The entry is soft-deleted
        journalService.deleteEntry(entry.getId());
        accountService.deactivateAccount(sales.getId());

        // Then: The account is inactive but still resolvable by id
        assertFalse(accountService.getAccount(sales.getId()).isActive());
        assertTrue(accountService.listAccounts(true).stream().noneMatch(a -> a.getId().equals(sales.getId())));
        assertTrue(accountService.listAccounts(false).stream().anyMatch(a -> a.getId().equals(sales.getId())));
    }

    @Test
    @DisplayName("Category cannot change once entries reference the account")
    void testCategoryImmutableWhenReferenced() {
        Account cash = newAccount("Cash", AccountCategory.ASSET);
        Account fees = newAccount("Fees", AccountCategory.EXPENSE);

        // Unreferenced: category may change
        Account changed = accountService.updateAccount(fees.getId(), null, AccountCategory.LIABILITY, null, null);
        assertEquals(AccountCategory.LIABILITY, changed.getCategory());

        journalService.createEntry(JournalEntryRequest.builder()
            .entryDate("2024-06-02")
            .debitAccountId(cash.getId())
            .creditAccountId(fees.getId())
            .amount(1000L)
            .build());

        assertThrows(ValidationException.class, () ->
            accountService.updateAccount(fees.getId(), null, AccountCategory.EXPENSE, null, null));

        // Renaming is still allowed
        Account renamed = accountService.updateAccount(fees.getId(), "Bank fees " + suffix, null, null, 42);
        assertEquals("Bank fees " + suffix, renamed.getName());
        assertEquals(42, renamed.getDisplayOrder());
        assertEquals(AccountCategory.LIABILITY, renamed.getCategory());
    }

    @Test
    @DisplayName("Unknown account id is not found")
    void testUnknownAccount() {
        assertThrows(NotFoundException.class, () -> accountService.getAccount(Long.MAX_VALUE));
        assertThrows(NotFoundException.class, () -> accountService.deactivateAccount(Long.MAX_VALUE));
    }
}
