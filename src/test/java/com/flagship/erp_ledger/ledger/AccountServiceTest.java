package com.flagship.erp_ledger.ledger;

import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.ValidationException;
import com.flagship.erp_ledger.ledger.dto.UpdateAccountRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AccountServiceTest {

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private LedgerRepository ledgerRepository;

    @InjectMocks
    private AccountService accountService;

    private final TenantScope scope = TenantScope.of(UUID.randomUUID(), UUID.randomUUID());

    private Account account(AccountType type, boolean system) {
        return Account.builder()
            .id(UUID.randomUUID())
            .businessId(scope.getBusinessId())
            .code("6100")
            .name("Office Supplies")
            .type(type)
            .active(true)
            .systemAccount(system)
            .createdAt(Instant.now())
            .build();
    }

    private void stubFind(Account account) {
        when(accountRepository.findById(scope.getBusinessId(), account.getId())).thenReturn(Optional.of(account));
    }

    @Test
    @DisplayName("Account without entries or children is deleted")
    void deletesUnusedAccount() {
        Account account = account(AccountType.EXPENSE, false);
        stubFind(account);
        when(ledgerRepository.existsForAccount(scope.getBusinessId(), account.getId())).thenReturn(false);
        when(accountRepository.hasChildren(scope.getBusinessId(), account.getId())).thenReturn(false);

        assertEquals(AccountDeletion.DELETED, accountService.delete(scope, account.getId()));
        verify(accountRepository).delete(scope.getBusinessId(), account.getId());
    }

    @Test
    @DisplayName("Account with ledger entries is deactivated instead of deleted")
    void deactivatesUsedAccount() {
        Account account = account(AccountType.EXPENSE, false);
        stubFind(account);
        when(ledgerRepository.existsForAccount(scope.getBusinessId(), account.getId())).thenReturn(true);

        assertEquals(AccountDeletion.DEACTIVATED, accountService.delete(scope, account.getId()));

        ArgumentCaptor<Account> updated = ArgumentCaptor.forClass(Account.class);
        verify(accountRepository).update(updated.capture());
        assertFalse(updated.getValue().isActive());
        verify(accountRepository, never()).delete(any(), any());
    }

    @Test
    @DisplayName("System accounts cannot be deleted")
    void systemAccountCannotBeDeleted() {
        Account account = account(AccountType.ASSET, true);
        stubFind(account);

        assertThrows(ValidationException.class, () -> accountService.delete(scope, account.getId()));
        verify(accountRepository, never()).delete(any(), any());
    }

    @Test
    @DisplayName("Duplicate account codes are rejected")
    void duplicateCode() {
        when(accountRepository.findByCode(scope.getBusinessId(), "6100"))
            .thenReturn(Optional.of(account(AccountType.EXPENSE, false)));

        assertThrows(ValidationException.class, () -> accountService.create(scope, "6100", "Stationery",
            AccountType.EXPENSE, null, null));
        verify(accountRepository, never()).insert(any());
    }

    @Test
    @DisplayName("Type of an account with entries cannot change")
    void typeChangeWithEntries() {
        Account account = account(AccountType.EXPENSE, false);
        stubFind(account);
        when(ledgerRepository.existsForAccount(eq(scope.getBusinessId()), eq(account.getId()))).thenReturn(true);

        UpdateAccountRequest changes = UpdateAccountRequest.builder().accountType(AccountType.ASSET).build();

        assertThrows(ValidationException.class, () -> accountService.update(scope, account.getId(), changes));
        verify(accountRepository, never()).update(any());
    }

    @Test
    @DisplayName("Payment accounts must be assets")
    void paymentAccountMustBeAsset() {
        Account account = account(AccountType.EXPENSE, false);
        stubFind(account);

        assertThrows(ValidationException.class, () -> accountService.requirePaymentAccount(scope, account.getId()));
    }
}
