package com.flagship.erp_ledger.posting;

import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.exception.ConfigurationException;
import com.flagship.erp_ledger.ledger.PostingLine;
import com.flagship.erp_ledger.ledger.PostingRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PostingRulesTest {

    private final PostingRules rules = new PostingRules();
    private final UUID businessId = UUID.randomUUID();
    private final Map<WellKnownAccount, UUID> mapped = new EnumMap<>(WellKnownAccount.class);
    private PostingAccounts accounts;

    @BeforeEach
    void setUp() {
        for (WellKnownAccount role : WellKnownAccount.values()) {
            mapped.put(role, UUID.randomUUID());
        }
        accounts = new PostingAccounts(businessId, mapped);
    }

    private DocumentRef ref(DocumentType type, String number) {
        return DocumentRef.builder()
            .businessId(businessId)
            .branchId(UUID.randomUUID())
            .documentType(type)
            .documentId(UUID.randomUUID())
            .documentNumber(number)
            .transactionDate(LocalDate.of(2024, 1, 15))
            .customerId(UUID.randomUUID())
            .build();
    }

    private static PostingLine lineFor(PostingRequest request, UUID accountId) {
        return request.getLines().stream()
            .filter(line -> line.getAccountId().equals(accountId))
            .findFirst()
            .orElseThrow();
    }

    @Test
    @DisplayName("Sales invoice: Dr AR total, Cr revenue sub-total, Cr VAT")
    void salesInvoiceWithVat() {
        PostingRequest request = rules.salesInvoice(ref(DocumentType.SALES_INVOICE, "INV-00001"),
            new BigDecimal("25.00"), new BigDecimal("2.50"), new BigDecimal("27.50"), accounts);

        assertTrue(request.isBalanced());
        assertEquals(3, request.getLines().size());
        assertEquals(new BigDecimal("27.50"), lineFor(request, mapped.get(WellKnownAccount.ACCOUNTS_RECEIVABLE)).getDebit());
        assertEquals(new BigDecimal("25.00"), lineFor(request, mapped.get(WellKnownAccount.SALES_REVENUE)).getCredit());
        assertEquals(new BigDecimal("2.50"), lineFor(request, mapped.get(WellKnownAccount.VAT_PAYABLE)).getCredit());
        assertEquals("Invoice INV-00001", request.getDescription());
    }

    @Test
    @DisplayName("Sales invoice without VAT has no VAT line and needs no VAT account")
    void salesInvoiceWithoutVat() {
        mapped.remove(WellKnownAccount.VAT_PAYABLE);
        PostingAccounts withoutVat = new PostingAccounts(businessId, mapped);

        PostingRequest request = rules.salesInvoice(ref(DocumentType.SALES_INVOICE, "INV-00002"),
            new BigDecimal("40.00"), BigDecimal.ZERO, new BigDecimal("40.00"), withoutVat);

        assertTrue(request.isBalanced());
        assertEquals(2, request.getLines().size());
    }

    @Test
    @DisplayName("Purchase bill: Dr inventory, Dr VAT, Cr AP")
    void purchaseBill() {
        PostingRequest request = rules.purchaseBill(ref(DocumentType.PURCHASE_BILL, "PO-00001"),
            new BigDecimal("100.00"), new BigDecimal("7.50"), new BigDecimal("107.50"), accounts);

        assertTrue(request.isBalanced());
        assertEquals(new BigDecimal("100.00"), lineFor(request, mapped.get(WellKnownAccount.INVENTORY)).getDebit());
        assertEquals(new BigDecimal("7.50"), lineFor(request, mapped.get(WellKnownAccount.VAT_PAYABLE)).getDebit());
        assertEquals(new BigDecimal("107.50"), lineFor(request, mapped.get(WellKnownAccount.ACCOUNTS_PAYABLE)).getCredit());
    }

    @Test
    @DisplayName("Invoice payment: Dr payment account, Cr AR")
    void invoicePayment() {
        UUID cash = UUID.randomUUID();

        PostingRequest request = rules.invoicePayment(ref(DocumentType.SALES_INVOICE, "INV-00003"),
            new BigDecimal("10.00"), cash, accounts);

        assertTrue(request.isBalanced());
        assertEquals(new BigDecimal("10.00"), lineFor(request, cash).getDebit());
        assertEquals(new BigDecimal("10.00"), lineFor(request, mapped.get(WellKnownAccount.ACCOUNTS_RECEIVABLE)).getCredit());
        assertEquals("Payment for Invoice INV-00003", request.getDescription());
    }

    @Test
    @DisplayName("Fund transfer: Dr destination, Cr source")
    void fundTransfer() {
        UUID from = UUID.randomUUID();
        UUID to = UUID.randomUUID();

        PostingRequest request = rules.fundTransfer(ref(DocumentType.FUND_TRANSFER, "FT-00001"),
            from, "Operating", to, "Savings", new BigDecimal("300.00"), null);

        assertTrue(request.isBalanced());
        assertEquals(new BigDecimal("300.00"), lineFor(request, to).getDebit());
        assertEquals(new BigDecimal("300.00"), lineFor(request, from).getCredit());
        assertEquals("Fund transfer FT-00001", request.getDescription());
    }

    @Test
    @DisplayName("Payslip payment splits gross into net pay and withheld deductions")
    void payslipPayment() {
        UUID bank = UUID.randomUUID();

        PostingRequest request = rules.payslipPayment(ref(DocumentType.PAYSLIP, "PS-00001"),
            new BigDecimal("1000.00"), new BigDecimal("850.00"), new BigDecimal("150.00"), bank, accounts);

        assertTrue(request.isBalanced());
        assertEquals(3, request.getLines().size());
        assertEquals(new BigDecimal("1000.00"), lineFor(request, mapped.get(WellKnownAccount.SALARIES_EXPENSE)).getDebit());
        assertEquals(new BigDecimal("850.00"), lineFor(request, bank).getCredit());
        assertEquals(new BigDecimal("150.00"), lineFor(request, mapped.get(WellKnownAccount.PAYROLL_LIABILITIES)).getCredit());
    }

    @Test
    @DisplayName("Customer and document identity are copied onto the request")
    void referenceIsCopied() {
        DocumentRef ref = ref(DocumentType.CREDIT_NOTE, "CN-00001");

        PostingRequest request = rules.creditNote(ref, "INV-00009", new BigDecimal("5.00"), accounts);

        assertEquals(ref.getDocumentId(), request.getDocumentId());
        assertEquals(ref.getCustomerId(), request.getCustomerId());
        assertEquals(DocumentType.CREDIT_NOTE, request.getDocumentType());
        assertEquals(ref.getTransactionDate(), request.getTransactionDate());
    }

    @Test
    @DisplayName("A missing well-known account fails with a configuration error")
    void missingMapping() {
        mapped.remove(WellKnownAccount.DEPRECIATION_EXPENSE);
        PostingAccounts incomplete = new PostingAccounts(businessId, mapped);

        ConfigurationException error = assertThrows(ConfigurationException.class,
            () -> rules.depreciation(ref(DocumentType.FIXED_ASSET, null), "Van", BigDecimal.TEN, incomplete));
        assertTrue(error.getMessage().contains("Depreciation Expense"));
    }

    @Test
    @DisplayName("Write-off: Dr operating expenses, Cr AR for the unpaid remainder")
    void invoiceWriteOff() {
        PostingRequest request = rules.invoiceWriteOff(ref(DocumentType.SALES_INVOICE, "INV-00004"),
            new BigDecimal("70.00"), accounts);

        assertTrue(request.isBalanced());
        assertEquals(2, request.getLines().size());
        assertEquals(new BigDecimal("70.00"), lineFor(request, mapped.get(WellKnownAccount.OPERATING_EXPENSES)).getDebit());
        assertEquals(new BigDecimal("70.00"), lineFor(request, mapped.get(WellKnownAccount.ACCOUNTS_RECEIVABLE)).getCredit());
        assertEquals("Bad debt write-off for Invoice INV-00004", request.getDescription());
    }

    @Test
    @DisplayName("Credit note: Dr sales revenue, Cr AR for the returned value")
    void creditNote() {
        PostingRequest request = rules.creditNote(ref(DocumentType.CREDIT_NOTE, "CN-00002"), "INV-00010",
            new BigDecimal("25.00"), accounts);

        assertTrue(request.isBalanced());
        assertEquals(new BigDecimal("25.00"), lineFor(request, mapped.get(WellKnownAccount.SALES_REVENUE)).getDebit());
        assertEquals(new BigDecimal("25.00"), lineFor(request, mapped.get(WellKnownAccount.ACCOUNTS_RECEIVABLE)).getCredit());
        assertEquals("Credit Note CN-00002 for Invoice INV-00010", request.getDescription());
    }

    @Test
    @DisplayName("Debit note: Dr AP, Cr inventory for the returned value")
    void debitNote() {
        PostingRequest request = rules.debitNote(ref(DocumentType.DEBIT_NOTE, "DN-00001"), "SUP-77",
            new BigDecimal("60.00"), accounts);

        assertTrue(request.isBalanced());
        assertEquals(new BigDecimal("60.00"), lineFor(request, mapped.get(WellKnownAccount.ACCOUNTS_PAYABLE)).getDebit());
        assertEquals(new BigDecimal("60.00"), lineFor(request, mapped.get(WellKnownAccount.INVENTORY)).getCredit());
        assertEquals("Debit Note DN-00001 for Bill SUP-77", request.getDescription());
    }

    @Test
    @DisplayName("Depreciation: Dr depreciation expense, Cr accumulated depreciation")
    void depreciation() {
        PostingRequest request = rules.depreciation(ref(DocumentType.FIXED_ASSET, null), "Delivery van",
            new BigDecimal("2000.00"), accounts);

        assertTrue(request.isBalanced());
        assertEquals(new BigDecimal("2000.00"), lineFor(request, mapped.get(WellKnownAccount.DEPRECIATION_EXPENSE)).getDebit());
        assertEquals(new BigDecimal("2000.00"), lineFor(request, mapped.get(WellKnownAccount.ACCUMULATED_DEPRECIATION)).getCredit());
        assertEquals("Depreciation of Delivery van", request.getDescription());
    }

    @Test
    @DisplayName("Bank deposit: Dr bank chart account, Cr counter account")
    void bankDeposit() {
        UUID bank = UUID.randomUUID();
        UUID equity = UUID.randomUUID();

        PostingRequest request = rules.bankDeposit(ref(DocumentType.BANK_DEPOSIT, null), bank, equity,
            new BigDecimal("500.00"), "Owner top-up");

        assertTrue(request.isBalanced());
        assertEquals(new BigDecimal("500.00"), lineFor(request, bank).getDebit());
        assertEquals(new BigDecimal("500.00"), lineFor(request, equity).getCredit());
        assertEquals("Owner top-up", request.getDescription());
    }

    @Test
    @DisplayName("Bank withdrawal: Dr counter account, Cr bank chart account")
    void bankWithdrawal() {
        UUID bank = UUID.randomUUID();
        UUID expense = UUID.randomUUID();

        PostingRequest request = rules.bankWithdrawal(ref(DocumentType.BANK_WITHDRAWAL, null), bank, expense,
            new BigDecimal("120.00"), "Office rent");

        assertTrue(request.isBalanced());
        assertEquals(new BigDecimal("120.00"), lineFor(request, expense).getDebit());
        assertEquals(new BigDecimal("120.00"), lineFor(request, bank).getCredit());
    }

    @Test
    @DisplayName("A zero-value invoice produces no lines at all")
    void zeroValueInvoice() {
        PostingRequest request = rules.salesInvoice(ref(DocumentType.SALES_INVOICE, "INV-00005"),
            new BigDecimal("0.00"), new BigDecimal("0.00"), new BigDecimal("0.00"), accounts);

        assertFalse(request.hasLines());
        assertTrue(request.isBalanced());
    }

    @Test
    @DisplayName("Zero-value returns and bills produce no lines")
    void zeroValueReturnsAndBills() {
        assertFalse(rules.creditNote(ref(DocumentType.CREDIT_NOTE, "CN-00003"), "INV-00005",
            new BigDecimal("0.00"), accounts).hasLines());
        assertFalse(rules.debitNote(ref(DocumentType.DEBIT_NOTE, "DN-00002"), "PO-00001",
            new BigDecimal("0.00"), accounts).hasLines());
        assertFalse(rules.purchaseBill(ref(DocumentType.PURCHASE_BILL, "PO-00003"),
            new BigDecimal("0.00"), new BigDecimal("0.00"), new BigDecimal("0.00"), accounts).hasLines());
    }
}
