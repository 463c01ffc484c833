package com.flagship.bookkeeping.report;

import com.flagship.bookkeeping.common.exception.NotFoundException;
import com.flagship.bookkeeping.common.exception.ValidationException;
import com.flagship.bookkeeping.ledger.Account;
import com.flagship.bookkeeping.ledger.AccountCategory;
import com.flagship.bookkeeping.ledger.AccountService;
import com.flagship.bookkeeping.ledger.JournalEntry;
import com.flagship.bookkeeping.ledger.JournalEntryRequest;
import com.flagship.bookkeeping.ledger.JournalService;
import com.flagship.bookkeeping.ledger.OpeningBalance;
import com.flagship.bookkeeping.ledger.OpeningBalanceService;
import com.flagship.bookkeeping.ledger.dto.OpeningBalanceRequest;
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

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Trial balance and general ledger over a small set of postings.
 *
 * Fixture (fiscal year 2024):
 * - Opening: cash 50000, loan 30000
 * - 2023-12-31 cash / sales 999 (previous year, ignored)
 * - 2024-02-10 cash / sales 11000
 * - 2024-03-05 supplies / cash 3300
 * - 2024-04-20 cash / loan 20000
 * - 2024-05-01 loan / cash 5000
 * - 2024-06-15 cash / sales 7777 (deleted)
 */
@SpringBootTest
@Testcontainers
class BalanceServiceTest {

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
    private BalanceService balanceService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private JournalService journalService;

    @Autowired
    private OpeningBalanceService openingBalanceService;

    private Account cash;
    private Account sales;
    private Account supplies;
    private Account loan;

    @BeforeEach
    void setUp() {
        String suffix = UUID.randomUUID().toString().substring(0, 8);
        cash = accountService.createAccount("RC" + suffix, "Cash " + suffix, AccountCategory.ASSET, null);
        sales = accountService.createAccount("RS" + suffix, "Sales " + suffix, AccountCategory.REVENUE, null);
        supplies = accountService.createAccount("RX" + suffix, "Supplies " + suffix, AccountCategory.EXPENSE, null);
        loan = accountService.createAccount("RL" + suffix, "Loan " + suffix, AccountCategory.LIABILITY, null);

        openingBalanceService.saveOpeningBalances(2024, List.of(
            OpeningBalanceRequest.builder().accountId(cash.getId()).amount(50_000).note("brought forward").build(),
            OpeningBalanceRequest.builder().accountId(loan.getId()).amount(30_000).build()
        ));

        post("2023-12-31", cash, sales, 999);
        post("2024-02-10", cash, sales, 11_000);
        post("2024-03-05", supplies, cash, 3_300);
        post("2024-04-20", cash, loan, 20_000);
        post("2024-05-01", loan, cash, 5_000);
        JournalEntry deleted = post("2024-06-15", cash, sales, 7_777);
        journalService.deleteEntry(deleted.getId());
    }

    private JournalEntry post(String date, Account debit, Account credit, long amount) {
        return journalService.createEntry(JournalEntryRequest.builder()
            .entryDate(date)
            .debitAccountId(debit.getId())
            .creditAccountId(credit.getId())
            .amount(amount)
            .taxClassification("out-of-scope")
            .build());
    }

    private static TrialBalanceRow row(List<TrialBalanceRow> rows, Account account) {
        return rows.stream()
            .filter(r -> r.getAccountId().equals(account.getId()))
            .findFirst()
            .orElseThrow();
    }

    @Test
    @DisplayName("Full-year trial balance signs balances on each account's normal side")
    void testFullYearTrialBalance() {
        // When: The whole of 2024 is reported
        List<TrialBalanceRow> rows = balanceService.trialBalance(2024, null, null);

        // Then: Debit-normal accounts grow with debits
        TrialBalanceRow cashRow = row(rows, cash);
        assertEquals(50_000, cashRow.getOpeningBalance());
        assertEquals(50_000, cashRow.getCarryForward());
        assertEquals(31_000, cashRow.getDebitTotal());
        assertEquals(8_300, cashRow.getCreditTotal());
        assertEquals(72_700, cashRow.getClosingBalance());
        assertEquals(3_300, row(rows, supplies).getClosingBalance());

        // And: Credit-normal accounts grow with credits
        assertEquals(11_000, row(rows, sales).getClosingBalance());
        TrialBalanceRow loanRow = row(rows, loan);
        assertEquals(30_000, loanRow.getOpeningBalance());
        assertEquals(5_000, loanRow.getDebitTotal());
        assertEquals(20_000, loanRow.getCreditTotal());
        assertEquals(45_000, loanRow.getClosingBalance());
    }

    @Test
    @DisplayName("Movement before the window start is carried forward")
    void testCarryForward() {
        // When: Only April onwards is reported
        List<TrialBalanceRow> rows = balanceService.trialBalance(
            2024, LocalDate.of(2024, 4, 1), LocalDate.of(2024, 12, 31));

        // Then: February and March movement sits in the carry-forward
        TrialBalanceRow cashRow = row(rows, cash);
        assertEquals(50_000, cashRow.getOpeningBalance());
        assertEquals(57_700, cashRow.getCarryForward());
        assertEquals(20_000, cashRow.getDebitTotal());
        assertEquals(5_000, cashRow.getCreditTotal());
        assertEquals(72_700, cashRow.getClosingBalance());

        TrialBalanceRow salesRow = row(rows, sales);
        assertEquals(11_000, salesRow.getCarryForward());
        assertEquals(0, salesRow.getDebitTotal());
        assertEquals(0, salesRow.getCreditTotal());
        assertEquals(11_000, salesRow.getClosingBalance());
    }

    @Test
    @DisplayName("Closing equals carry-forward plus normal-side movement for every account")
    void testClosingIdentity() {
        List<TrialBalanceRow> rows = balanceService.trialBalance(
            2024, LocalDate.of(2024, 3, 1), LocalDate.of(2024, 4, 30));

        for (TrialBalanceRow r : rows) {
            long expected = r.getCategory().getNormalSide()
                .apply(r.getCarryForward(), r.getDebitTotal(), r.getCreditTotal());
            assertEquals(expected, r.getClosingBalance(), "account " + r.getCode());
        }
    }

    @Test
    @DisplayName("Ledger running balance ends at the trial-balance closing")
    void testLedgerMatchesTrialBalance() {
        // Given: A window from April
        LocalDate start = LocalDate.of(2024, 4, 1);
        LocalDate end = LocalDate.of(2024, 12, 31);

        // When: Cash ledger and trial balance are computed
        GeneralLedger ledger = balanceService.generalLedger(cash.getId(), start, end);
        TrialBalanceRow cashRow = row(balanceService.trialBalance(2024, start, end), cash);

        // Then: Lines run from the carry-forward, with the other leg as counter account
        assertEquals(2024, ledger.getFiscalYear());
        assertEquals(57_700, ledger.getCarryForward());
        assertEquals(2, ledger.getEntries().size());

        LedgerLine first = ledger.getEntries().get(0);
        assertEquals(20_000, first.getDebitAmount());
        assertEquals(0, first.getCreditAmount());
        assertEquals(loan.getId(), first.getCounterAccountId());
        assertEquals(77_700, first.getBalance());

        LedgerLine second = ledger.getEntries().get(1);
        assertEquals(5_000, second.getCreditAmount());
        assertEquals(72_700, second.getBalance());

        assertEquals(cashRow.getClosingBalance(), ledger.getClosingBalance());
        assertEquals(cashRow.getClosingBalance(), second.getBalance());
    }

    @Test
    @DisplayName("Same-day postings run in entry id order")
    void testSameDayLedgerOrder() {
        // Given: Three postings to cash on one day, in a mixed direction
        JournalEntry first = post("2024-07-01", cash, sales, 400);
        JournalEntry second = post("2024-07-01", supplies, cash, 150);
        JournalEntry third = post("2024-07-01", cash, loan, 1_000);

        // When: July is reported
        GeneralLedger ledger = balanceService.generalLedger(
            cash.getId(), LocalDate.of(2024, 7, 1), LocalDate.of(2024, 7, 31));

        // Then: Lines follow creation order and the balance accumulates along it
        assertEquals(72_700, ledger.getCarryForward());
        assertEquals(List.of(first.getId(), second.getId(), third.getId()),
            ledger.getEntries().stream().map(LedgerLine::getEntryId).toList());
        assertEquals(List.of(73_100L, 72_950L, 73_950L),
            ledger.getEntries().stream().map(LedgerLine::getBalance).toList());
        assertEquals(73_950, ledger.getClosingBalance());
    }

    @Test
    @DisplayName("Credit-normal ledger decreases on debits")
    void testLoanLedger() {
        GeneralLedger ledger = balanceService.generalLedger(loan.getId(), LocalDate.of(2024, 1, 1), null);

        assertEquals(30_000, ledger.getCarryForward());
        assertEquals(List.of(50_000L, 45_000L),
            ledger.getEntries().stream().map(LedgerLine::getBalance).toList());
        assertEquals(LocalDate.of(2024, 12, 31), ledger.getEndDate());
    }

    @Test
    @DisplayName("Opening balances list every active account and saves atomically")
    void testOpeningBalances() {
        List<OpeningBalance> listed = openingBalanceService.listOpeningBalances(2024);
        OpeningBalance cashOpening = listed.stream()
            .filter(o -> o.getAccountId().equals(cash.getId())).findFirst().orElseThrow();
        OpeningBalance salesOpening = listed.stream()
            .filter(o -> o.getAccountId().equals(sales.getId())).findFirst().orElseThrow();
        assertEquals(50_000, cashOpening.getAmount());
        assertEquals("brought forward", cashOpening.getNote());
        assertEquals(0, salesOpening.getAmount());

        // A bad row rolls back the rows saved before it
        assertThrows(NotFoundException.class, () -> openingBalanceService.saveOpeningBalances(2024, List.of(
            OpeningBalanceRequest.builder().accountId(cash.getId()).amount(1).build(),
            OpeningBalanceRequest.builder().accountId(Long.MAX_VALUE).amount(2).build()
        )));
        assertEquals(50_000, openingBalanceService.openingAmount(2024, cash.getId()));
    }

    @Test
    @DisplayName("Invalid windows and unknown accounts are rejected")
    void testInvalidRequests() {
        assertThrows(ValidationException.class, () ->
            balanceService.trialBalance(2024, LocalDate.of(2024, 5, 1), LocalDate.of(2024, 4, 1)));
        assertThrows(ValidationException.class, () ->
            balanceService.trialBalance(2024, LocalDate.of(2023, 12, 1), null));
        assertThrows(NotFoundException.class, () ->
            balanceService.generalLedger(Long.MAX_VALUE, null, null));
    }
}
