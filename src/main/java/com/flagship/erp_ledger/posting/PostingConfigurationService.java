package com.flagship.erp_ledger.posting;

import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.NotFoundException;
import com.flagship.erp_ledger.common.exception.ValidationException;
import com.flagship.erp_ledger.ledger.Account;
import com.flagship.erp_ledger.ledger.AccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves and stores each tenant's well-known accounts.
 *
 * Resolution happens once, in {@link #configure}: an explicit override wins, otherwise the tenant's active
 * account with the role's default name is used. Postings read the stored mapping through
 * {@link #forTenant}, which is cached per business.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PostingConfigurationService {

    private final AccountRepository accountRepository;
    private final PostingAccountMappingRepository mappingRepository;
    private final Map<UUID, PostingAccounts> cache = new ConcurrentHashMap<>();

    @Transactional
    public PostingAccounts configure(TenantScope scope, Map<WellKnownAccount, UUID> overrides) {
        UUID businessId = scope.getBusinessId();
        Map<WellKnownAccount, UUID> existing = mappingRepository.findByBusiness(businessId);
        Map<WellKnownAccount, UUID> resolved = new EnumMap<>(WellKnownAccount.class);

        for (WellKnownAccount role : WellKnownAccount.values()) {
            Optional<Account> account = resolve(businessId, role, overrides.get(role));
            if (account.isPresent()) {
                requireExpectedType(role, account.get());
                mappingRepository.upsert(businessId, role, account.get().getId());
                resolved.put(role, account.get().getId());
            } else if (existing.containsKey(role)) {
                resolved.put(role, existing.get(role));
            } else {
                log.warn("No account found for {} (expected '{}') in business {}",
                        role, role.getDefaultName(), businessId);
            }
        }

        evictOnCompletion(businessId);
        log.info("Posting accounts configured for business {}: {}/{} roles mapped",
                businessId, resolved.size(), WellKnownAccount.values().length);
        return new PostingAccounts(businessId, resolved);
    }

    @Transactional(readOnly = true)
    public PostingAccounts forTenant(UUID businessId) {
        return cache.computeIfAbsent(businessId,
            id -> new PostingAccounts(id, mappingRepository.findByBusiness(id)));
    }

    public void evict(UUID businessId) {
        cache.remove(businessId);
    }

    private Optional<Account> resolve(UUID businessId, WellKnownAccount role, UUID overrideId) {
        if (overrideId != null) {
            Account account = accountRepository.findById(businessId, overrideId)
                .orElseThrow(() -> NotFoundException.of("Account", overrideId));
            if (!account.isActive()) {
                throw new ValidationException("Account " + account.getDisplayName() + " is inactive");
            }
            return Optional.of(account);
        }
        return accountRepository.findActiveByName(businessId, role.getDefaultName());
    }

    private void requireExpectedType(WellKnownAccount role, Account account) {
        if (account.getType() != role.getExpectedType()) {
            throw new ValidationException(String.format("%s must be a %s account, but %s is %s",
                role, role.getExpectedType(), account.getDisplayName(), account.getType()));
        }
    }

    private void evictOnCompletion(UUID businessId) {
        evict(businessId);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    evict(businessId);
                }
            });
        }
    }
}
