package com.flagship.erp_ledger.posting;

import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.ledger.dto.AccountResponse;
import com.flagship.erp_ledger.posting.dto.PostingAccountsResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Tenant bootstrap: default chart, posting-account mapping and document number previews.
 */
@RestController
@RequestMapping("/api/setup")
@RequiredArgsConstructor
public class SetupController {

    private final ChartOfAccountsSeeder seeder;
    private final PostingConfigurationService postingConfigurationService;
    private final DocumentNumberService documentNumberService;

    @PostMapping("/chart-of-accounts")
    public ResponseEntity<Map<String, Object>> seedChart(TenantScope scope) {
        ChartOfAccountsSeeder.SeedResult result = seeder.seed(scope);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("created", result.getCreated().stream().map(AccountResponse::from).toList());
        body.put("posting_accounts", PostingAccountsResponse.from(result.getPostingAccounts()));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @GetMapping("/posting-accounts")
    public PostingAccountsResponse postingAccounts(TenantScope scope) {
        return PostingAccountsResponse.from(postingConfigurationService.forTenant(scope.getBusinessId()));
    }

    /**
     * Re-resolves every role; the body may pin specific roles to specific accounts.
     */
    @PutMapping("/posting-accounts")
    public PostingAccountsResponse configure(TenantScope scope,
                                             @RequestBody(required = false) Map<WellKnownAccount, UUID> overrides) {
        Map<WellKnownAccount, UUID> pinned = new EnumMap<>(WellKnownAccount.class);
        if (overrides != null) {
            pinned.putAll(overrides);
        }
        return PostingAccountsResponse.from(postingConfigurationService.configure(scope, pinned));
    }

    @GetMapping("/next-number/{documentType}")
    public Map<String, String> nextNumber(TenantScope scope, @PathVariable("documentType") DocumentType documentType) {
        if (!documentType.isNumbered()) {
            throw new IllegalArgumentException(documentType + " documents are not numbered");
        }
        return Map.of("next_number", documentNumberService.peek(scope.getBusinessId(), documentType));
    }
}
