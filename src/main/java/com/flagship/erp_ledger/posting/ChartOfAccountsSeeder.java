package com.flagship.erp_ledger.posting;

import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.ledger.Account;
import com.flagship.erp_ledger.ledger.AccountRepository;
import com.flagship.erp_ledger.ledger.AccountService;
import com.flagship.erp_ledger.ledger.AccountType;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Creates the standard system-protected chart of accounts for a new business and maps its well-known
 * accounts. Accounts whose code already exists are left alone, so seeding twice is harmless.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChartOfAccountsSeeder {

    static final List<DefaultAccount> DEFAULT_CHART = List.of(
        new DefaultAccount("1000", "Cash", AccountType.ASSET),
        new DefaultAccount("1010", "Bank", AccountType.ASSET),
        new DefaultAccount("3000", "Owner's Equity", AccountType.EQUITY),
        new DefaultAccount("3100", "Retained Earnings", AccountType.EQUITY)
    );

    private final AccountService accountService;
    private final AccountRepository accountRepository;
    private final PostingConfigurationService postingConfigurationService;

    @Transactional
    public SeedResult seed(TenantScope scope) {
        List<DefaultAccount> chart = new ArrayList<>(DEFAULT_CHART);
        for (WellKnownAccount role : WellKnownAccount.values()) {
            chart.add(new DefaultAccount(role.getDefaultCode(), role.getDefaultName(), role.getExpectedType()));
        }

        List<Account> created = new ArrayList<>();
        for (DefaultAccount account : chart) {
            if (accountRepository.findByCode(scope.getBusinessId(), account.getCode()).isEmpty()) {
                created.add(accountService.createSystemAccount(scope, account.getCode(), account.getName(), account.getType()));
            }
        }

        PostingAccounts postingAccounts = postingConfigurationService.configure(scope, Map.of());
        log.info("Seeded chart of accounts for business {}: {} accounts created", scope.getBusinessId(), created.size());
        return new SeedResult(created, postingAccounts);
    }

    @Value
    static class DefaultAccount {
        String code;
        String name;
        AccountType type;
    }

    @Value
    public static class SeedResult {
        List<Account> created;
        PostingAccounts postingAccounts;
    }
}
