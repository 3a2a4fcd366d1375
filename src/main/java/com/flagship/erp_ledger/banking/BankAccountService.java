package com.flagship.erp_ledger.banking;

import com.flagship.erp_ledger.banking.dto.CreateBankAccountRequest;
import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.InsufficientFundsException;
import com.flagship.erp_ledger.common.exception.NotFoundException;
import com.flagship.erp_ledger.common.exception.ValidationException;
import com.flagship.erp_ledger.ledger.Account;
import com.flagship.erp_ledger.ledger.AccountService;
import com.flagship.erp_ledger.ledger.AccountType;
import com.flagship.erp_ledger.ledger.LedgerService;
import com.flagship.erp_ledger.posting.DocumentRef;
import com.flagship.erp_ledger.posting.PostingRules;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Bank accounts and the money movements that touch only one of them.
 *
 * Balances are never written here directly: every movement is a ledger posting and
 * {@link BankBalanceSynchronizer} carries it onto the bank account.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BankAccountService {

    private final BankAccountRepository bankAccountRepository;
    private final FundTransferRepository transferRepository;
    private final AccountService accountService;
    private final LedgerService ledgerService;
    private final PostingRules postingRules;

    @Transactional
    public BankAccount create(TenantScope scope, CreateBankAccountRequest request) {
        Account chartAccount = accountService.get(scope, request.getChartAccountId());
        if (chartAccount.getType() != AccountType.ASSET) {
            throw new ValidationException("Bank accounts must be linked to an asset account, "
                + chartAccount.getDisplayName() + " is " + chartAccount.getType());
        }
        if (bankAccountRepository.existsByChartAccountId(chartAccount.getId())) {
            throw new ValidationException("Account " + chartAccount.getDisplayName() + " is already linked to a bank account");
        }

        BigDecimal ledgerBalance = accountService.getBalance(scope, chartAccount.getId()).getRawBalance();
        BankAccount account = bankAccountRepository.save(BankAccount.create(scope, request.getAccountName(),
            request.getBankName(), request.getAccountNumber(), request.getCurrency(), chartAccount.getId(), ledgerBalance));
        log.info("Bank account created: name={}, chartAccount={}, openingBalance={}",
                account.getAccountName(), chartAccount.getDisplayName(), ledgerBalance);
        return account;
    }

    @Transactional(readOnly = true)
    public BankAccount get(TenantScope scope, UUID bankAccountId) {
        return bankAccountRepository.findByIdAndBusinessId(bankAccountId, scope.getBusinessId())
            .orElseThrow(() -> NotFoundException.of("Bank account", bankAccountId));
    }

    @Transactional(readOnly = true)
    public List<BankAccount> list(TenantScope scope, boolean includeInactive) {
        return includeInactive
            ? bankAccountRepository.findByBusinessIdOrderByAccountName(scope.getBusinessId())
            : bankAccountRepository.findByBusinessIdAndActiveTrueOrderByAccountName(scope.getBusinessId());
    }

    /**
     * Dr bank, Cr counter account.
     *
     * @return id of the deposit document in the ledger
     */
    @Transactional
    public UUID deposit(TenantScope scope, UUID bankAccountId, BigDecimal amount, UUID counterAccountId,
                        LocalDate date, String description) {
        BankAccount account = lockActive(scope, bankAccountId);
        requirePositive(amount);
        UUID documentId = UUID.randomUUID();
        String label = description != null ? description : "Deposit to " + account.getAccountName();

        ledgerService.post(postingRules.bankDeposit(ref(scope, DocumentType.BANK_DEPOSIT, documentId, date),
            account.getChartAccountId(), counterAccountId, amount, label));
        log.info("Deposit recorded: account={}, amount={}, balance={}", account.getAccountName(), amount,
                account.getCurrentBalance());
        return documentId;
    }

    /**
     * Dr counter account, Cr bank. The bank balance must cover the amount.
     */
    @Transactional
    public UUID withdraw(TenantScope scope, UUID bankAccountId, BigDecimal amount, UUID counterAccountId,
                         LocalDate date, String description) {
        BankAccount account = lockActive(scope, bankAccountId);
        requirePositive(amount);
        if (!account.canCover(amount)) {
            log.warn("Withdrawal rejected: account={}, balance={}, amount={}", account.getAccountName(),
                    account.getCurrentBalance(), amount);
            throw new InsufficientFundsException(account.getAccountName(), account.getCurrentBalance(), amount);
        }
        UUID documentId = UUID.randomUUID();
        String label = description != null ? description : "Withdrawal from " + account.getAccountName();

        ledgerService.post(postingRules.bankWithdrawal(ref(scope, DocumentType.BANK_WITHDRAWAL, documentId, date),
            account.getChartAccountId(), counterAccountId, amount, label));
        log.info("Withdrawal recorded: account={}, amount={}, balance={}", account.getAccountName(), amount,
                account.getCurrentBalance());
        return documentId;
    }

    @Transactional
    public Reconciliation reconcile(TenantScope scope, UUID bankAccountId, BigDecimal statementBalance, LocalDate date) {
        BankAccount account = lock(scope, bankAccountId);
        LocalDate statementDate = date != null ? date : LocalDate.now();
        BigDecimal difference = account.reconcile(statementBalance, statementDate);
        log.info("Bank account reconciled: account={}, book={}, statement={}, difference={}",
                account.getAccountName(), account.getCurrentBalance(), statementBalance, difference);
        return new Reconciliation(account.getId(), statementDate, account.getCurrentBalance(),
            account.getLastReconciledBalance(), difference);
    }

    /**
     * Removes a bank account that no transfer refers to. The linked chart account and its entries remain.
     */
    @Transactional
    public void delete(TenantScope scope, UUID bankAccountId) {
        BankAccount account = lock(scope, bankAccountId);
        if (transferRepository.existsForBankAccount(account.getId())) {
            throw new ValidationException("Bank account " + account.getAccountName() + " has fund transfers and cannot be deleted");
        }
        bankAccountRepository.delete(account);
        log.info("Bank account deleted: {}", account.getAccountName());
    }

    @Transactional(readOnly = true)
    public BalanceConsistency verifyConsistency(TenantScope scope, UUID bankAccountId) {
        BankAccount account = get(scope, bankAccountId);
        BigDecimal ledgerBalance = accountService.getBalance(scope, account.getChartAccountId()).getRawBalance();
        BalanceConsistency result = new BalanceConsistency(account.getId(), account.getChartAccountId(),
            account.getCurrentBalance(), ledgerBalance);
        if (!result.isConsistent()) {
            log.warn("Bank balance out of sync with ledger: account={}, current={}, ledger={}",
                    account.getAccountName(), account.getCurrentBalance(), ledgerBalance);
        }
        return result;
    }

    /**
     * Refuses a payment out of a chart account that backs a bank account without enough funds. Chart accounts
     * with no bank account behind them are not checked.
     */
    @Transactional
    public void assertSufficientFunds(UUID businessId, UUID chartAccountId, BigDecimal amount) {
        bankAccountRepository.findByChartAccountForUpdate(businessId, chartAccountId).ifPresent(account -> {
            if (!account.canCover(amount)) {
                log.warn("Payment rejected: account={}, balance={}, amount={}", account.getAccountName(),
                        account.getCurrentBalance(), amount);
                throw new InsufficientFundsException(account.getAccountName(), account.getCurrentBalance(), amount);
            }
        });
    }

    BankAccount lock(TenantScope scope, UUID bankAccountId) {
        return bankAccountRepository.findForUpdate(bankAccountId, scope.getBusinessId())
            .orElseThrow(() -> NotFoundException.of("Bank account", bankAccountId));
    }

    private BankAccount lockActive(TenantScope scope, UUID bankAccountId) {
        BankAccount account = lock(scope, bankAccountId);
        if (!account.isActive()) {
            throw new ValidationException("Bank account " + account.getAccountName() + " is inactive");
        }
        return account;
    }

    private static void requirePositive(BigDecimal amount) {
        if (!Money.isPositive(amount)) {
            throw new ValidationException("Amount must be greater than zero");
        }
    }

    private static DocumentRef ref(TenantScope scope, DocumentType type, UUID documentId, LocalDate date) {
        return DocumentRef.builder()
            .businessId(scope.getBusinessId())
            .branchId(scope.getBranchId())
            .documentType(type)
            .documentId(documentId)
            .transactionDate(date != null ? date : LocalDate.now())
            .build();
    }
}
