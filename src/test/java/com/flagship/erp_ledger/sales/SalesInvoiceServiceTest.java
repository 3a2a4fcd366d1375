package com.flagship.erp_ledger.sales;

import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.SettlementStatus;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.dto.DocumentItemRequest;
import com.flagship.erp_ledger.common.exception.ValidationException;
import com.flagship.erp_ledger.inventory.StockService;
import com.flagship.erp_ledger.ledger.AccountService;
import com.flagship.erp_ledger.ledger.LedgerService;
import com.flagship.erp_ledger.ledger.PostingLine;
import com.flagship.erp_ledger.ledger.PostingRequest;
import com.flagship.erp_ledger.posting.DocumentNumberService;
import com.flagship.erp_ledger.posting.PostingAccounts;
import com.flagship.erp_ledger.posting.PostingConfigurationService;
import com.flagship.erp_ledger.posting.PostingRules;
import com.flagship.erp_ledger.posting.WellKnownAccount;
import com.flagship.erp_ledger.sales.dto.CreateInvoiceRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SalesInvoiceServiceTest {

    @Mock
    private SalesInvoiceRepository invoiceRepository;

    @Mock
    private DocumentNumberService documentNumberService;

    @Mock
    private PostingConfigurationService postingConfiguration;

    @Mock
    private LedgerService ledgerService;

    @Mock
    private StockService stockService;

    @Mock
    private AccountService accountService;

    private SalesInvoiceService invoiceService;

    private final TenantScope scope = TenantScope.of(UUID.randomUUID(), UUID.randomUUID());
    private final Map<WellKnownAccount, UUID> mapped = new EnumMap<>(WellKnownAccount.class);

    @BeforeEach
    void setUp() {
        invoiceService = new SalesInvoiceService(invoiceRepository, documentNumberService, postingConfiguration,
            new PostingRules(), ledgerService, stockService, accountService);
        for (WellKnownAccount role : WellKnownAccount.values()) {
            mapped.put(role, UUID.randomUUID());
        }
    }

    private SalesInvoice invoice(String price) {
        SalesInvoice invoice = SalesInvoice.create(scope, "INV-00001", UUID.randomUUID(), LocalDate.of(2024, 2, 1),
            LocalDate.of(2024, 2, 29), null, BigDecimal.ZERO);
        invoice.addItem(UUID.randomUUID(), "Widget", new BigDecimal("4"), new BigDecimal(price));
        invoice.recalculate();
        ReflectionTestUtils.setField(invoice, "id", UUID.randomUUID());
        return invoice;
    }

    private static PostingLine lineFor(PostingRequest request, UUID accountId) {
        return request.getLines().stream()
            .filter(line -> line.getAccountId().equals(accountId))
            .findFirst()
            .orElseThrow();
    }

    @Test
    @DisplayName("Write-off posts the unpaid remainder as Dr operating expenses, Cr AR")
    void writeOffPostsBadDebt() {
        // Given
        SalesInvoice invoice = invoice("25.00");
        invoice.applyPayment(new BigDecimal("30.00"));
        when(invoiceRepository.findForUpdate(invoice.getId(), scope.getBusinessId())).thenReturn(Optional.of(invoice));
        when(postingConfiguration.forTenant(scope.getBusinessId()))
            .thenReturn(new PostingAccounts(scope.getBusinessId(), mapped));

        // When
        SalesInvoice result = invoiceService.writeOff(scope, invoice.getId(), LocalDate.of(2024, 6, 30));

        // Then
        assertEquals(SettlementStatus.WRITTEN_OFF, result.getStatus());
        ArgumentCaptor<PostingRequest> posted = ArgumentCaptor.forClass(PostingRequest.class);
        verify(ledgerService).post(posted.capture());
        PostingRequest request = posted.getValue();
        assertEquals(new BigDecimal("70.00"), lineFor(request, mapped.get(WellKnownAccount.OPERATING_EXPENSES)).getDebit());
        assertEquals(new BigDecimal("70.00"), lineFor(request, mapped.get(WellKnownAccount.ACCOUNTS_RECEIVABLE)).getCredit());
        assertEquals(invoice.getCustomerId(), request.getCustomerId());
        assertEquals(LocalDate.of(2024, 6, 30), request.getTransactionDate());
        assertEquals(DocumentType.SALES_INVOICE, request.getDocumentType());
    }

    @Test
    @DisplayName("A second write-off is refused and posts nothing")
    void writeOffTwice() {
        SalesInvoice invoice = invoice("25.00");
        invoice.writeOff();
        when(invoiceRepository.findForUpdate(invoice.getId(), scope.getBusinessId())).thenReturn(Optional.of(invoice));
        when(postingConfiguration.forTenant(scope.getBusinessId()))
            .thenReturn(new PostingAccounts(scope.getBusinessId(), mapped));

        assertThrows(ValidationException.class, () -> invoiceService.writeOff(scope, invoice.getId(), null));
        verifyNoInteractions(ledgerService);
    }

    @Test
    @DisplayName("A zero-priced invoice is saved and moves stock without posting to the ledger")
    void zeroValueInvoice() {
        // Given
        CreateInvoiceRequest request = CreateInvoiceRequest.builder()
            .customerId(UUID.randomUUID())
            .invoiceDate(LocalDate.of(2024, 3, 1))
            .vatRate(new BigDecimal("10"))
            .item(new DocumentItemRequest(UUID.randomUUID(), "Free sample", new BigDecimal("2"), new BigDecimal("0.00")))
            .build();
        when(postingConfiguration.forTenant(scope.getBusinessId()))
            .thenReturn(new PostingAccounts(scope.getBusinessId(), mapped));
        when(documentNumberService.next(scope.getBusinessId(), DocumentType.SALES_INVOICE)).thenReturn("INV-00002");
        when(invoiceRepository.save(any(SalesInvoice.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        SalesInvoice invoice = invoiceService.create(scope, request);

        // Then
        assertEquals("INV-00002", invoice.getInvoiceNumber());
        assertEquals(new BigDecimal("0.00"), invoice.getTotalAmount());
        verify(stockService).apply(eq(scope), anyList());
        verify(ledgerService, never()).post(any());
    }
}
