package com.flagship.erp_ledger.report;

import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.common.SettlementStatus;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.ValidationException;
import com.flagship.erp_ledger.ledger.Account;
import com.flagship.erp_ledger.ledger.AccountRepository;
import com.flagship.erp_ledger.ledger.AccountService;
import com.flagship.erp_ledger.ledger.AccountTotals;
import com.flagship.erp_ledger.ledger.AccountType;
import com.flagship.erp_ledger.ledger.LedgerRepository;
import com.flagship.erp_ledger.posting.PostingConfigurationService;
import com.flagship.erp_ledger.posting.WellKnownAccount;
import com.flagship.erp_ledger.purchase.PurchaseBill;
import com.flagship.erp_ledger.purchase.PurchaseBillRepository;
import com.flagship.erp_ledger.sales.SalesInvoice;
import com.flagship.erp_ledger.sales.SalesInvoiceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;

/**
 * Financial statements derived on demand from the ledger. Nothing here writes.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReportService {

    private static final Set<SettlementStatus> OPEN = EnumSet.of(SettlementStatus.UNPAID, SettlementStatus.PARTIAL);

    private final AccountRepository accountRepository;
    private final AccountService accountService;
    private final LedgerRepository ledgerRepository;
    private final PostingConfigurationService postingConfiguration;
    private final SalesInvoiceRepository invoiceRepository;
    private final PurchaseBillRepository billRepository;

    /**
     * Active accounts with a non-zero raw balance up to {@code asOf} (everything when null).
     */
    public TrialBalance trialBalance(TenantScope scope, LocalDate asOf) {
        Map<UUID, AccountTotals> totals = ledgerRepository.totalsByAccount(scope.getBusinessId(), null, asOf);
        List<TrialBalance.Line> lines = new ArrayList<>();
        BigDecimal totalDebit = Money.ZERO;
        BigDecimal totalCredit = Money.ZERO;

        for (Account account : accountRepository.findAll(scope.getBusinessId(), false)) {
            AccountTotals accountTotals = totals.getOrDefault(account.getId(), AccountTotals.ZERO);
            if (accountTotals.getRawBalance().signum() == 0) {
                continue;
            }
            lines.add(new TrialBalance.Line(account.getId(), account.getCode(), account.getName(), account.getType(),
                accountTotals.getDebitTotal(), accountTotals.getCreditTotal(), accountTotals.getRawBalance()));
            totalDebit = totalDebit.add(accountTotals.getDebitTotal());
            totalCredit = totalCredit.add(accountTotals.getCreditTotal());
        }
        return new TrialBalance(asOf, lines, totalDebit, totalCredit);
    }

    /**
     * Assets at their raw signed balance, liabilities and equity at absolute value.
     */
    public BalanceSheet balanceSheet(TenantScope scope, LocalDate asOf) {
        Map<UUID, AccountTotals> totals = ledgerRepository.totalsByAccount(scope.getBusinessId(), null, asOf);
        List<Account> accounts = accountRepository.findAll(scope.getBusinessId(), false);

        List<StatementLine> assets = statementLines(accounts, totals, AccountType.ASSET, AccountTotals::getRawBalance);
        List<StatementLine> liabilities = statementLines(accounts, totals, AccountType.LIABILITY,
            accountTotals -> accountTotals.getRawBalance().abs());
        List<StatementLine> equity = statementLines(accounts, totals, AccountType.EQUITY,
            accountTotals -> accountTotals.getRawBalance().abs());

        return new BalanceSheet(asOf, assets, liabilities, equity, sum(assets), sum(liabilities), sum(equity));
    }

    public IncomeStatement incomeStatement(TenantScope scope, LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw new ValidationException("Start and end dates are required");
        }
        if (endDate.isBefore(startDate)) {
            throw new ValidationException("End date " + endDate + " is before start date " + startDate);
        }
        Map<UUID, AccountTotals> totals = ledgerRepository.totalsByAccount(scope.getBusinessId(), startDate, endDate);
        List<Account> accounts = accountRepository.findAll(scope.getBusinessId(), false);

        List<StatementLine> revenue = statementLines(accounts, totals, AccountType.REVENUE,
            accountTotals -> accountTotals.getCreditTotal().subtract(accountTotals.getDebitTotal()));
        List<StatementLine> expenses = statementLines(accounts, totals, AccountType.EXPENSE,
            AccountTotals::getRawBalance);

        return new IncomeStatement(startDate, endDate, revenue, expenses, sum(revenue), sum(expenses));
    }

    /**
     * Entries ordered by (transaction date, sequence) with a running balance. For a single account with a start
     * date the running balance begins at the account's balance before that date.
     */
    public GeneralLedger generalLedger(TenantScope scope, UUID accountId, LocalDate startDate, LocalDate endDate) {
        BigDecimal opening = Money.ZERO;
        if (accountId != null) {
            accountService.get(scope, accountId);
            if (startDate != null) {
                opening = ledgerRepository.totalsForAccount(scope.getBusinessId(), accountId, null,
                    startDate.minusDays(1)).getRawBalance();
            }
        }
        return GeneralLedger.fold(accountId, startDate, endDate, opening,
            ledgerRepository.findEntries(scope.getBusinessId(), accountId, startDate, endDate));
    }

    public AgingReport receivablesAging(TenantScope scope, LocalDate asOf) {
        List<SalesInvoice> invoices = invoiceRepository.findByBusinessIdAndStatusIn(scope.getBusinessId(), OPEN);
        return AgingCalculator.age(invoices, SalesInvoice::getCustomerId, asOf != null ? asOf : LocalDate.now());
    }

    public AgingReport payablesAging(TenantScope scope, LocalDate asOf) {
        List<PurchaseBill> bills = billRepository.findByBusinessIdAndStatusIn(scope.getBusinessId(), OPEN);
        return AgingCalculator.age(bills, PurchaseBill::getVendorId, asOf != null ? asOf : LocalDate.now());
    }

    /**
     * Accounts Receivable balance of one customer, from ledger entries tagged with the customer.
     */
    public CounterpartyBalance customerBalance(TenantScope scope, UUID customerId) {
        UUID receivable = postingConfiguration.forTenant(scope.getBusinessId())
            .require(WellKnownAccount.ACCOUNTS_RECEIVABLE);
        AccountTotals totals = ledgerRepository.totalsForCounterparty(scope.getBusinessId(), receivable, customerId, null);
        return new CounterpartyBalance(customerId, receivable, totals.getDebitTotal(), totals.getCreditTotal(),
            totals.getRawBalance());
    }

    /**
     * Accounts Payable balance owed to one vendor.
     */
    public CounterpartyBalance vendorBalance(TenantScope scope, UUID vendorId) {
        UUID payable = postingConfiguration.forTenant(scope.getBusinessId())
            .require(WellKnownAccount.ACCOUNTS_PAYABLE);
        AccountTotals totals = ledgerRepository.totalsForCounterparty(scope.getBusinessId(), payable, null, vendorId);
        return new CounterpartyBalance(vendorId, payable, totals.getDebitTotal(), totals.getCreditTotal(),
            totals.getRawBalance().negate());
    }

    private static List<StatementLine> statementLines(List<Account> accounts, Map<UUID, AccountTotals> totals,
                                                      AccountType type, Function<AccountTotals, BigDecimal> amount) {
        List<StatementLine> lines = new ArrayList<>();
        for (Account account : accounts) {
            if (account.getType() != type) {
                continue;
            }
            BigDecimal value = amount.apply(totals.getOrDefault(account.getId(), AccountTotals.ZERO));
            if (value.signum() != 0) {
                lines.add(new StatementLine(account.getId(), account.getCode(), account.getName(), value));
            }
        }
        return lines;
    }

    private static BigDecimal sum(List<StatementLine> lines) {
        return Money.sum(lines.stream().map(StatementLine::getAmount).toList());
    }
}
