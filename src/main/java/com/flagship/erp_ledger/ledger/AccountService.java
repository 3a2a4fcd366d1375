package com.flagship.erp_ledger.ledger;

import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.NotFoundException;
import com.flagship.erp_ledger.common.exception.ValidationException;
import com.flagship.erp_ledger.ledger.dto.UpdateAccountRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Chart of accounts management and derived balances.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AccountRepository accountRepository;
    private final LedgerRepository ledgerRepository;

    @Transactional
    public Account create(TenantScope scope, String code, String name, AccountType type,
                          UUID parentId, String description) {
        return insert(scope, code, name, type, parentId, description, false);
    }

    /**
     * Creates a protected account that can be renamed but never deactivated or deleted.
     */
    @Transactional
    public Account createSystemAccount(TenantScope scope, String code, String name, AccountType type) {
        return insert(scope, code, name, type, null, null, true);
    }

    @Transactional
    public Account update(TenantScope scope, UUID accountId, UpdateAccountRequest changes) {
        Account existing = get(scope, accountId);
        Account.AccountBuilder updated = existing.toBuilder();

        if (changes.getCode() != null && !changes.getCode().equals(existing.getCode())) {
            requireUniqueCode(scope.getBusinessId(), changes.getCode());
            updated.code(changes.getCode());
        }
        if (changes.getName() != null) {
            if (changes.getName().isBlank()) {
                throw new ValidationException("Account name must not be blank");
            }
            updated.name(changes.getName());
        }
        if (changes.getDescription() != null) {
            updated.description(changes.getDescription());
        }
        if (changes.getParentId() != null) {
            requireParent(scope.getBusinessId(), changes.getParentId(), accountId);
            updated.parentId(changes.getParentId());
        }
        if (changes.getAccountType() != null && changes.getAccountType() != existing.getType()) {
            if (existing.isSystemAccount()) {
                throw new ValidationException("The type of system account " + existing.getDisplayName() + " cannot change");
            }
            if (ledgerRepository.existsForAccount(scope.getBusinessId(), accountId)) {
                throw new ValidationException("Account " + existing.getDisplayName() + " has ledger entries; its type cannot change");
            }
            updated.type(changes.getAccountType());
        }
        if (changes.getActive() != null) {
            if (!changes.getActive() && existing.isSystemAccount()) {
                throw new ValidationException("System account " + existing.getDisplayName() + " cannot be deactivated");
            }
            updated.active(changes.getActive());
        }

        Account result = updated.build();
        accountRepository.update(result);
        log.info("Account updated: {}", result.getDisplayName());
        return result;
    }

    @Transactional(readOnly = true)
    public Account get(TenantScope scope, UUID accountId) {
        return accountRepository.findById(scope.getBusinessId(), accountId)
            .orElseThrow(() -> NotFoundException.of("Account", accountId));
    }

    /**
     * Cash and bank style account that money is paid into or out of: active and of type ASSET.
     */
    @Transactional(readOnly = true)
    public Account requirePaymentAccount(TenantScope scope, UUID accountId) {
        Account account = get(scope, accountId);
        if (account.getType() != AccountType.ASSET) {
            throw new ValidationException("Payment account " + account.getDisplayName() + " must be an asset account");
        }
        if (!account.isActive()) {
            throw new ValidationException("Payment account " + account.getDisplayName() + " is inactive");
        }
        return account;
    }

    @Transactional(readOnly = true)
    public List<Account> list(TenantScope scope, boolean includeInactive) {
        return accountRepository.findAll(scope.getBusinessId(), includeInactive);
    }

    @Transactional(readOnly = true)
    public List<Account> listByType(TenantScope scope, AccountType type) {
        return accountRepository.findByType(scope.getBusinessId(), type);
    }

    @Transactional(readOnly = true)
    public AccountBalance getBalance(TenantScope scope, UUID accountId) {
        Account account = get(scope, accountId);
        return AccountBalance.of(account,
            ledgerRepository.totalsForAccount(scope.getBusinessId(), accountId, null, null));
    }

    /**
     * Removes an account, or deactivates it when ledger entries reference it.
     */
    @Transactional
    public AccountDeletion delete(TenantScope scope, UUID accountId) {
        Account account = get(scope, accountId);
        if (account.isSystemAccount()) {
            throw new ValidationException("System account " + account.getDisplayName() + " cannot be deleted");
        }
        if (ledgerRepository.existsForAccount(scope.getBusinessId(), accountId)) {
            accountRepository.update(account.toBuilder().active(false).build());
            log.info("Account {} has ledger entries; deactivated instead of deleted", account.getDisplayName());
            return AccountDeletion.DEACTIVATED;
        }
        if (accountRepository.hasChildren(scope.getBusinessId(), accountId)) {
            throw new ValidationException("Account " + account.getDisplayName() + " has sub-accounts");
        }
        accountRepository.delete(scope.getBusinessId(), accountId);
        log.info("Account deleted: {}", account.getDisplayName());
        return AccountDeletion.DELETED;
    }

    private Account insert(TenantScope scope, String code, String name, AccountType type,
                           UUID parentId, String description, boolean system) {
        if (code == null || code.isBlank() || name == null || name.isBlank()) {
            throw new ValidationException("Account code and name are required");
        }
        if (type == null) {
            throw new ValidationException("Account type is required");
        }
        requireUniqueCode(scope.getBusinessId(), code);
        if (parentId != null) {
            requireParent(scope.getBusinessId(), parentId, null);
        }

        Account account = Account.builder()
            .id(UUID.randomUUID())
            .businessId(scope.getBusinessId())
            .code(code)
            .name(name)
            .type(type)
            .parentId(parentId)
            .description(description)
            .active(true)
            .systemAccount(system)
            .createdAt(Instant.now())
            .build();
        accountRepository.insert(account);
        log.info("Account created: {} ({})", account.getDisplayName(), type);
        return account;
    }

    private void requireUniqueCode(UUID businessId, String code) {
        if (accountRepository.findByCode(businessId, code).isPresent()) {
            throw new ValidationException("Account code already exists: " + code);
        }
    }

    private void requireParent(UUID businessId, UUID parentId, UUID selfId) {
        if (parentId.equals(selfId)) {
            throw new ValidationException("An account cannot be its own parent");
        }
        accountRepository.findById(businessId, parentId)
            .orElseThrow(() -> NotFoundException.of("Parent account", parentId));
    }
}
