package com.flagship.erp_ledger.ledger;

import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.ledger.dto.AccountBalanceResponse;
import com.flagship.erp_ledger.ledger.dto.AccountResponse;
import com.flagship.erp_ledger.ledger.dto.CreateAccountRequest;
import com.flagship.erp_ledger.ledger.dto.UpdateAccountRequest;
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
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;

    @GetMapping
    public List<AccountResponse> list(TenantScope scope,
                                      @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive,
                                      @RequestParam(name = "type", required = false) AccountType type) {
        List<Account> accounts = type != null
            ? accountService.listByType(scope, type)
            : accountService.list(scope, includeInactive);
        return accounts.stream().map(AccountResponse::from).toList();
    }

    @PostMapping
    public ResponseEntity<AccountResponse> create(TenantScope scope, @Valid @RequestBody CreateAccountRequest request) {
        Account account = accountService.create(scope, request.getCode(), request.getName(),
            request.getAccountType(), request.getParentId(), request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping("/{id}")
    public AccountResponse get(TenantScope scope, @PathVariable("id") UUID id) {
        return AccountResponse.from(accountService.get(scope, id));
    }

    @PutMapping("/{id}")
    public AccountResponse update(TenantScope scope, @PathVariable("id") UUID id,
                                  @Valid @RequestBody UpdateAccountRequest request) {
        return AccountResponse.from(accountService.update(scope, id, request));
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> delete(TenantScope scope, @PathVariable("id") UUID id) {
        AccountDeletion outcome = accountService.delete(scope, id);
        return Map.of("account_id", id, "outcome", outcome);
    }

    @GetMapping("/{id}/balance")
    public AccountBalanceResponse balance(TenantScope scope, @PathVariable("id") UUID id) {
        return AccountBalanceResponse.from(accountService.getBalance(scope, id));
    }
}
