package com.flagship.erp_ledger.budget;

import com.flagship.erp_ledger.budget.dto.BudgetItemRequest;
import com.flagship.erp_ledger.budget.dto.CreateBudgetRequest;
import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.NotFoundException;
import com.flagship.erp_ledger.common.exception.ValidationException;
import com.flagship.erp_ledger.ledger.Account;
import com.flagship.erp_ledger.ledger.AccountRepository;
import com.flagship.erp_ledger.ledger.AccountTotals;
import com.flagship.erp_ledger.ledger.LedgerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetService {

    private final BudgetRepository budgetRepository;
    private final AccountRepository accountRepository;
    private final LedgerRepository ledgerRepository;

    @Transactional
    public Budget create(TenantScope scope, CreateBudgetRequest request) {
        UUID businessId = scope.getBusinessId();
        if (budgetRepository.existsByBusinessIdAndNameAndFiscalYear(businessId, request.getName(), request.getFiscalYear())) {
            throw new ValidationException("Budget '" + request.getName() + "' already exists for " + request.getFiscalYear());
        }

        Set<UUID> accountIds = request.getItems().stream().map(BudgetItemRequest::getAccountId).collect(Collectors.toSet());
        Set<UUID> found = accountRepository.findAllById(businessId, accountIds).stream()
            .map(Account::getId)
            .collect(Collectors.toSet());
        for (UUID accountId : accountIds) {
            if (!found.contains(accountId)) {
                throw NotFoundException.of("Account", accountId);
            }
        }

        Budget budget = Budget.create(scope, request.getName(), request.getFiscalYear(), request.getDescription());
        for (BudgetItemRequest item : request.getItems()) {
            budget.addItem(item.getAccountId(), item.getAmount(), item.getMonth());
        }
        budget = budgetRepository.save(budget);
        log.info("Budget created: name={}, year={}, items={}", budget.getName(), budget.getFiscalYear(),
                budget.getItems().size());
        return budget;
    }

    @Transactional(readOnly = true)
    public Budget get(TenantScope scope, UUID budgetId) {
        return budgetRepository.findByIdAndBusinessId(budgetId, scope.getBusinessId())
            .orElseThrow(() -> NotFoundException.of("Budget", budgetId));
    }

    @Transactional(readOnly = true)
    public List<Budget> list(TenantScope scope) {
        return budgetRepository.findByBusinessIdOrderByFiscalYearDescNameAsc(scope.getBusinessId());
    }

    /**
     * Compares each item with the ledger activity of its account over the fiscal year, or over the item's
     * month when it has one. Actuals follow the account type's sign convention, so an expense budget is
     * compared with a positive expense figure.
     */
    @Transactional(readOnly = true)
    public BudgetComparison budgetVsActual(TenantScope scope, UUID budgetId) {
        Budget budget = get(scope, budgetId);
        UUID businessId = scope.getBusinessId();
        Map<UUID, Account> accounts = accountRepository.findAllById(businessId,
                budget.getItems().stream().map(BudgetItem::getAccountId).collect(Collectors.toSet()))
            .stream()
            .collect(Collectors.toMap(Account::getId, Function.identity()));

        List<BudgetLine> lines = new ArrayList<>();
        for (BudgetItem item : budget.getItems()) {
            Account account = accounts.get(item.getAccountId());
            if (account == null) {
                throw NotFoundException.of("Account", item.getAccountId());
            }
            AccountTotals totals = ledgerRepository.totalsForAccount(businessId, account.getId(),
                item.periodStart(budget.getFiscalYear()), item.periodEnd(budget.getFiscalYear()));
            BigDecimal actual = Money.of(account.getType().toReported(totals.getRawBalance()));
            lines.add(BudgetLine.of(account.getId(), account.getCode(), account.getName(), item.getMonth(),
                item.getAmount(), actual));
        }
        return BudgetComparison.of(budget, lines);
    }
}
