package com.flagship.toy_banking.ledger;

import com.flagship.toy_banking.ledger.dto.AccountResponse;
import com.flagship.toy_banking.ledger.dto.CreateAccountRequest;
import com.flagship.toy_banking.ledger.dto.LedgerEntryResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Local account management. Balances are read-only here; they only move through transfers.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final AccountService accountService;
    private final LedgerService ledgerService;

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        Account account = accountService.createAccount(
            request.getAccountNumber(), request.getOwnerName(), request.getInitialBalance());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping
    public List<AccountResponse> listAccounts() {
        return accountService.listAccounts().stream()
            .map(AccountResponse::from)
            .toList();
    }

    @GetMapping("/{id}")
    public AccountResponse getAccount(@PathVariable("id") UUID id) {
        return AccountResponse.from(accountService.getAccount(id));
    }

    @GetMapping("/{id}/entries")
    public List<LedgerEntryResponse> getEntries(@PathVariable("id") UUID id) {
        accountService.getAccount(id);
        return ledgerService.getEntriesForAccount(id).stream()
            .map(LedgerEntryResponse::from)
            .toList();
    }

    @PostMapping("/{id}/cancel")
    public AccountResponse cancelAccount(@PathVariable("id") UUID id) {
        return AccountResponse.from(accountService.cancelAccount(id));
    }
}
