package com.flagship.erp_ledger.report;

import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.ValidationException;
import com.flagship.erp_ledger.ledger.Account;
import com.flagship.erp_ledger.ledger.AccountRepository;
import com.flagship.erp_ledger.ledger.AccountService;
import com.flagship.erp_ledger.ledger.AccountTotals;
import com.flagship.erp_ledger.ledger.AccountType;
import com.flagship.erp_ledger.ledger.LedgerRepository;
import com.flagship.erp_ledger.posting.PostingConfigurationService;
import com.flagship.erp_ledger.purchase.PurchaseBillRepository;
import com.flagship.erp_ledger.sales.SalesInvoiceRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReportServiceTest {

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private AccountService accountService;

    @Mock
    private LedgerRepository ledgerRepository;

    @Mock
    private PostingConfigurationService postingConfiguration;

    @Mock
    private SalesInvoiceRepository invoiceRepository;

    @Mock
    private PurchaseBillRepository billRepository;

    @InjectMocks
    private ReportService reportService;

    private final TenantScope scope = TenantScope.of(UUID.randomUUID(), UUID.randomUUID());

    private Account account(String code, AccountType type) {
        return Account.builder()
            .id(UUID.randomUUID())
            .businessId(scope.getBusinessId())
            .code(code)
            .name("Account " + code)
            .type(type)
            .active(true)
            .build();
    }

    private static AccountTotals totals(String debit, String credit) {
        return new AccountTotals(new BigDecimal(debit), new BigDecimal(credit));
    }

    @Test
    @DisplayName("Revenue is reported as credits minus debits and expenses as debits minus credits, per line")
    void incomeStatementLineSigns() {
        // Given
        LocalDate start = LocalDate.of(2024, 1, 1);
        LocalDate end = LocalDate.of(2024, 3, 31);
        Account sales = account("4000", AccountType.REVENUE);
        Account otherIncome = account("4100", AccountType.REVENUE);
        Account operating = account("5000", AccountType.EXPENSE);
        Account discounts = account("5300", AccountType.EXPENSE);
        Account cash = account("1000", AccountType.ASSET);
        when(accountRepository.findAll(scope.getBusinessId(), false))
            .thenReturn(List.of(cash, sales, otherIncome, operating, discounts));
        when(ledgerRepository.totalsByAccount(scope.getBusinessId(), start, end)).thenReturn(Map.of(
            cash.getId(), totals("900.00", "350.00"),
            sales.getId(), totals("100.00", "1000.00"),
            operating.getId(), totals("400.00", "50.00"),
            discounts.getId(), totals("0.00", "20.00")));

        // When
        IncomeStatement statement = reportService.incomeStatement(scope, start, end);

        // Then
        assertEquals(1, statement.getRevenue().size());
        assertEquals(sales.getId(), statement.getRevenue().get(0).getAccountId());
        assertEquals(new BigDecimal("900.00"), statement.getRevenue().get(0).getAmount());

        assertEquals(2, statement.getExpenses().size());
        assertEquals(new BigDecimal("350.00"), statement.getExpenses().get(0).getAmount());
        assertEquals(new BigDecimal("-20.00"), statement.getExpenses().get(1).getAmount());

        assertEquals(new BigDecimal("900.00"), statement.getTotalRevenue());
        assertEquals(new BigDecimal("330.00"), statement.getTotalExpenses());
        assertEquals(new BigDecimal("570.00"), statement.getNetIncome());
    }

    @Test
    @DisplayName("An end date before the start date is rejected without reading the ledger")
    void invertedPeriod() {
        assertThrows(ValidationException.class,
            () -> reportService.incomeStatement(scope, LocalDate.of(2024, 3, 31), LocalDate.of(2024, 1, 1)));

        verifyNoInteractions(ledgerRepository, accountRepository);
    }
}
