package com.flagship.erp_ledger.integration;

import com.flagship.erp_ledger.banking.BalanceConsistency;
import com.flagship.erp_ledger.banking.BankAccount;
import com.flagship.erp_ledger.banking.BankAccountService;
import com.flagship.erp_ledger.banking.FundTransferService;
import com.flagship.erp_ledger.banking.dto.CreateBankAccountRequest;
import com.flagship.erp_ledger.banking.dto.CreateFundTransferRequest;
import com.flagship.erp_ledger.common.SettlementStatus;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.dto.DocumentItemRequest;
import com.flagship.erp_ledger.common.exception.InsufficientFundsException;
import com.flagship.erp_ledger.common.exception.InsufficientStockException;
import com.flagship.erp_ledger.idempotency.IdempotencyService;
import com.flagship.erp_ledger.idempotency.IdempotentOperation;
import com.flagship.erp_ledger.idempotency.IdempotentResult;
import com.flagship.erp_ledger.inventory.Product;
import com.flagship.erp_ledger.inventory.ProductService;
import com.flagship.erp_ledger.inventory.dto.CreateProductRequest;
import com.flagship.erp_ledger.journal.JournalService;
import com.flagship.erp_ledger.journal.dto.CreateJournalVoucherRequest;
import com.flagship.erp_ledger.journal.dto.JournalLineRequest;
import com.flagship.erp_ledger.ledger.Account;
import com.flagship.erp_ledger.ledger.AccountRepository;
import com.flagship.erp_ledger.ledger.AccountService;
import com.flagship.erp_ledger.posting.ChartOfAccountsSeeder;
import com.flagship.erp_ledger.report.BalanceSheet;
import com.flagship.erp_ledger.report.CounterpartyBalance;
import com.flagship.erp_ledger.report.GeneralLedger;
import com.flagship.erp_ledger.report.ReportService;
import com.flagship.erp_ledger.report.TrialBalance;
import com.flagship.erp_ledger.sales.SalesInvoice;
import com.flagship.erp_ledger.sales.SalesInvoiceService;
import com.flagship.erp_ledger.sales.dto.CreateInvoiceRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end posting against a real PostgreSQL schema. Every test works in its own business, so no cleanup is
 * needed between tests.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class LedgerPostingIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("erp_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("idempotency.redis.enabled", () -> "false");
    }

    private static final LocalDate JAN_10 = LocalDate.of(2024, 1, 10);

    @Autowired
    private ChartOfAccountsSeeder seeder;

    @Autowired
    private AccountRepository accountRepository;

    @Autowired
    private AccountService accountService;

    @Autowired
    private ProductService productService;

    @Autowired
    private SalesInvoiceService invoiceService;

    @Autowired
    private BankAccountService bankAccountService;

    @Autowired
    private FundTransferService transferService;

    @Autowired
    private JournalService journalService;

    @Autowired
    private ReportService reportService;

    @Autowired
    private IdempotencyService idempotencyService;

    private TenantScope scope;

    @BeforeEach
    void setUp() {
        scope = TenantScope.of(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());
        seeder.seed(scope);
    }

    private Account account(String code) {
        return accountRepository.findByCode(scope.getBusinessId(), code).orElseThrow();
    }

    private BigDecimal balanceOf(String code) {
        return accountService.getBalance(scope, account(code).getId()).getBalance();
    }

    private Product product(String openingStock) {
        return productService.create(scope, CreateProductRequest.builder()
            .name("Widget")
            .unit("pcs")
            .purchasePrice(new BigDecimal("60.00"))
            .salesPrice(new BigDecimal("100.00"))
            .openingStock(new BigDecimal(openingStock))
            .build());
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), () -> "expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("Invoice and full payment move receivables into cash")
    void invoiceThenPayment() {
        // Given
        Product widget = product("10");
        UUID customerId = UUID.randomUUID();

        // When
        SalesInvoice invoice = invoiceService.create(scope, CreateInvoiceRequest.builder()
            .customerId(customerId)
            .invoiceDate(JAN_10)
            .dueDate(JAN_10.plusDays(30))
            .vatRate(new BigDecimal("7.5"))
            .item(new DocumentItemRequest(widget.getId(), null, new BigDecimal("2"), new BigDecimal("100.00")))
            .build());

        // Then
        assertAmount("215.00", invoice.getTotalAmount());
        assertAmount("215.00", balanceOf("1100"));
        assertAmount("200.00", balanceOf("4000"));
        assertAmount("15.00", balanceOf("2100"));
        assertAmount("8", productService.get(scope, widget.getId()).getStockQuantity());

        // When
        SalesInvoice paid = invoiceService.recordPayment(scope, invoice.getId(), new BigDecimal("215.00"),
            account("1000").getId(), JAN_10.plusDays(5));

        // Then
        assertEquals(SettlementStatus.PAID, paid.getStatus());
        assertAmount("0.00", balanceOf("1100"));
        assertAmount("215.00", balanceOf("1000"));

        CounterpartyBalance customer = reportService.customerBalance(scope, customerId);
        assertAmount("0.00", customer.getBalance());

        TrialBalance trialBalance = reportService.trialBalance(scope, null);
        assertTrue(trialBalance.isBalanced());
    }

    @Test
    @DisplayName("Invoice that would drive stock negative leaves no trace")
    void negativeStockRollsBack() {
        // Given
        Product plenty = product("10");
        Product scarce = product("1");

        // When / Then
        assertThrows(InsufficientStockException.class, () -> invoiceService.create(scope, CreateInvoiceRequest.builder()
            .customerId(UUID.randomUUID())
            .invoiceDate(JAN_10)
            .item(new DocumentItemRequest(plenty.getId(), null, new BigDecimal("3"), new BigDecimal("100.00")))
            .item(new DocumentItemRequest(scarce.getId(), null, new BigDecimal("2"), new BigDecimal("100.00")))
            .build()));

        assertAmount("10", productService.get(scope, plenty.getId()).getStockQuantity());
        assertAmount("1", productService.get(scope, scarce.getId()).getStockQuantity());
        assertTrue(invoiceService.list(scope, null).isEmpty());
        assertTrue(reportService.trialBalance(scope, null).getLines().isEmpty());
    }

    @Test
    @DisplayName("Deposits, withdrawals and transfers keep bank balances in step with the ledger")
    void bankMovementsStayConsistent() {
        // Given
        BankAccount operating = bankAccountService.create(scope, CreateBankAccountRequest.builder()
            .accountName("Operating")
            .chartAccountId(account("1010").getId())
            .build());
        BankAccount petty = bankAccountService.create(scope, CreateBankAccountRequest.builder()
            .accountName("Petty Cash")
            .chartAccountId(account("1000").getId())
            .build());

        // When
        bankAccountService.deposit(scope, operating.getId(), new BigDecimal("1000.00"), account("3000").getId(),
            JAN_10, null);
        bankAccountService.withdraw(scope, operating.getId(), new BigDecimal("200.00"), account("5000").getId(),
            JAN_10, null);
        transferService.create(scope, CreateFundTransferRequest.builder()
            .fromAccountId(operating.getId())
            .toAccountId(petty.getId())
            .amount(new BigDecimal("300.00"))
            .transferDate(JAN_10)
            .build());

        // Then
        assertAmount("500.00", bankAccountService.get(scope, operating.getId()).getCurrentBalance());
        assertAmount("300.00", bankAccountService.get(scope, petty.getId()).getCurrentBalance());
        BalanceConsistency operatingCheck = bankAccountService.verifyConsistency(scope, operating.getId());
        BalanceConsistency pettyCheck = bankAccountService.verifyConsistency(scope, petty.getId());
        assertTrue(operatingCheck.isConsistent());
        assertTrue(pettyCheck.isConsistent());

        assertThrows(InsufficientFundsException.class, () -> bankAccountService.withdraw(scope, petty.getId(),
            new BigDecimal("300.01"), account("5000").getId(), JAN_10, null));
        assertAmount("300.00", bankAccountService.get(scope, petty.getId()).getCurrentBalance());
    }

    @Test
    @DisplayName("Balance sheet is out of balance by exactly the unclosed profit")
    void balanceSheetWithoutClosing() {
        // Given
        Product widget = product("5");
        invoiceService.create(scope, CreateInvoiceRequest.builder()
            .customerId(UUID.randomUUID())
            .invoiceDate(JAN_10)
            .vatRate(new BigDecimal("7.5"))
            .item(new DocumentItemRequest(widget.getId(), null, BigDecimal.ONE, new BigDecimal("200.00")))
            .build());

        // When
        BalanceSheet balanceSheet = reportService.balanceSheet(scope, null);

        // Then
        assertFalse(balanceSheet.isBalanced());
        BigDecimal gap = balanceSheet.getTotalAssets()
            .subtract(balanceSheet.getTotalLiabilities())
            .subtract(balanceSheet.getTotalEquity());
        assertAmount("200.00", gap);
        assertAmount("200.00", reportService.incomeStatement(scope, JAN_10, JAN_10).getNetIncome());
    }

    @Test
    @DisplayName("General ledger running balance ends at the account balance")
    void generalLedgerRunningBalance() {
        // Given
        UUID cash = account("1000").getId();
        UUID equity = account("3000").getId();
        UUID expenses = account("5000").getId();
        journalService.create(scope, voucher(JAN_10, cash, equity, "1000.00"));
        journalService.create(scope, voucher(JAN_10.plusDays(1), expenses, cash, "150.00"));
        journalService.create(scope, voucher(JAN_10.plusDays(2), expenses, cash, "50.00"));

        // When
        GeneralLedger full = reportService.generalLedger(scope, cash, null, null);
        GeneralLedger fromSecondDay = reportService.generalLedger(scope, cash, JAN_10.plusDays(1), null);

        // Then
        assertEquals(3, full.getLines().size());
        assertAmount("800.00", full.getClosingBalance());
        assertAmount("800.00", accountService.getBalance(scope, cash).getRawBalance());
        assertAmount("1000.00", fromSecondDay.getOpeningBalance());
        assertAmount("850.00", fromSecondDay.getLines().get(0).getRunningBalance());
        assertAmount("800.00", fromSecondDay.getClosingBalance());
    }

    @Test
    @DisplayName("Replaying an idempotency key posts once")
    void idempotentReplay() {
        // Given
        CreateJournalVoucherRequest request = voucher(JAN_10, account("1000").getId(), account("3000").getId(), "250.00");

        // When
        IdempotentResult first = idempotencyService.execute(scope, "jv-2024-01-10", IdempotentOperation.CREATE_JOURNAL_VOUCHER,
            () -> journalService.create(scope, request).getId());
        IdempotentResult second = idempotencyService.execute(scope, "jv-2024-01-10", IdempotentOperation.CREATE_JOURNAL_VOUCHER,
            () -> journalService.create(scope, request).getId());

        // Then
        assertFalse(first.isReplayed());
        assertTrue(second.isReplayed());
        assertEquals(first.getResourceId(), second.getResourceId());
        assertEquals(1, journalService.list(scope).size());
        assertAmount("250.00", balanceOf("1000"));
    }

    private static CreateJournalVoucherRequest voucher(LocalDate date, UUID debitAccount, UUID creditAccount,
                                                       String amount) {
        return CreateJournalVoucherRequest.builder()
            .voucherDate(date)
            .lines(List.of(
                new JournalLineRequest(debitAccount, new BigDecimal(amount), null, null),
                new JournalLineRequest(creditAccount, null, new BigDecimal(amount), null)))
            .build();
    }
}
