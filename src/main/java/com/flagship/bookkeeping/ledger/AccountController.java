package com.flagship.bookkeeping.ledger;

import com.flagship.bookkeeping.ledger.dto.CreateAccountRequest;
import com.flagship.bookkeeping.ledger.dto.UpdateAccountRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the chart of accounts.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;

    @GetMapping
    public List<Account> listAccounts(
            @RequestParam(name = "active_only", defaultValue = "true") boolean activeOnly) {
        return accountService.listAccounts(activeOnly);
    }

    @GetMapping("/{id}")
    public Account getAccount(@PathVariable("id") long id) {
        return accountService.getAccount(id);
    }

    @PostMapping
    public ResponseEntity<Account> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        Account account = accountService.createAccount(
            request.getCode(), request.getName(), request.getCategory(), request.getTaxDefault());
        return ResponseEntity.status(HttpStatus.CREATED).body(account);
    }

    @PutMapping("/{id}")
    public Account updateAccount(@PathVariable("id") long id, @Valid @RequestBody UpdateAccountRequest request) {
        return accountService.updateAccount(
            id, request.getName(), request.getCategory(), request.getTaxDefault(), request.getDisplayOrder());
    }

    /**
     * Deactivates the account. Accounts are never hard-deleted.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deactivateAccount(@PathVariable("id") long id) {
        accountService.deactivateAccount(id);
        return ResponseEntity.noContent().build();
    }
}
