package com.flagship.erp_ledger.sales;

import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.dto.ReturnItemRequest;
import com.flagship.erp_ledger.common.exception.ValidationException;
import com.flagship.erp_ledger.inventory.StockMovement;
import com.flagship.erp_ledger.inventory.StockService;
import com.flagship.erp_ledger.ledger.LedgerService;
import com.flagship.erp_ledger.ledger.PostingLine;
import com.flagship.erp_ledger.ledger.PostingRequest;
import com.flagship.erp_ledger.posting.DocumentNumberService;
import com.flagship.erp_ledger.posting.PostingAccounts;
import com.flagship.erp_ledger.posting.PostingConfigurationService;
import com.flagship.erp_ledger.posting.PostingRules;
import com.flagship.erp_ledger.posting.WellKnownAccount;
import com.flagship.erp_ledger.sales.dto.CreateCreditNoteRequest;
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
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Customer returns restock goods and reverse revenue against the original invoice.
 */
@ExtendWith(MockitoExtension.class)
class CreditNoteServiceTest {

    @Mock
    private CreditNoteRepository creditNoteRepository;

    @Mock
    private SalesInvoiceService invoiceService;

    @Mock
    private DocumentNumberService documentNumberService;

    @Mock
    private PostingConfigurationService postingConfiguration;

    @Mock
    private LedgerService ledgerService;

    @Mock
    private StockService stockService;

    private CreditNoteService creditNoteService;

    private final TenantScope scope = TenantScope.of(UUID.randomUUID(), UUID.randomUUID());
    private final Map<WellKnownAccount, UUID> mapped = new EnumMap<>(WellKnownAccount.class);
    private final UUID productId = UUID.randomUUID();

    private SalesInvoice invoice;
    private SalesInvoiceItem item;

    @BeforeEach
    void setUp() {
        creditNoteService = new CreditNoteService(creditNoteRepository, invoiceService, documentNumberService,
            postingConfiguration, new PostingRules(), ledgerService, stockService);
        for (WellKnownAccount role : WellKnownAccount.values()) {
            mapped.put(role, UUID.randomUUID());
        }
    }

    private void givenInvoice(String price) {
        invoice = SalesInvoice.create(scope, "INV-00007", UUID.randomUUID(), LocalDate.of(2024, 4, 1),
            null, null, BigDecimal.ZERO);
        item = invoice.addItem(productId, "Widget", new BigDecimal("4"), new BigDecimal(price));
        invoice.recalculate();
        ReflectionTestUtils.setField(invoice, "id", UUID.randomUUID());
        ReflectionTestUtils.setField(item, "id", UUID.randomUUID());
        when(invoiceService.lock(scope, invoice.getId())).thenReturn(invoice);
    }

    private void givenAccounts() {
        when(postingConfiguration.forTenant(scope.getBusinessId()))
            .thenReturn(new PostingAccounts(scope.getBusinessId(), mapped));
    }

    private CreateCreditNoteRequest returning(String quantity) {
        return CreateCreditNoteRequest.builder()
            .invoiceId(invoice.getId())
            .noteDate(LocalDate.of(2024, 4, 10))
            .item(new ReturnItemRequest(item.getId(), new BigDecimal(quantity)))
            .build();
    }

    private static PostingLine lineFor(PostingRequest request, UUID accountId) {
        return request.getLines().stream()
            .filter(line -> line.getAccountId().equals(accountId))
            .findFirst()
            .orElseThrow();
    }

    @Test
    @DisplayName("A return restocks the goods and posts Dr revenue, Cr AR at the invoice price")
    @SuppressWarnings("unchecked")
    void returnPostsAndRestocks() {
        // Given
        givenInvoice("25.00");
        givenAccounts();
        when(documentNumberService.next(scope.getBusinessId(), DocumentType.CREDIT_NOTE)).thenReturn("CN-00001");
        when(creditNoteRepository.save(any(CreditNote.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        CreditNote note = creditNoteService.create(scope, returning("1"));

        // Then
        assertEquals("CN-00001", note.getCreditNoteNumber());
        assertEquals(new BigDecimal("25.00"), note.getTotalAmount());
        assertEquals(0, BigDecimal.ONE.compareTo(item.getReturnedQuantity()));

        ArgumentCaptor<List<StockMovement>> movements = ArgumentCaptor.forClass(List.class);
        verify(stockService).apply(eq(scope), movements.capture());
        assertEquals(productId, movements.getValue().get(0).getProductId());
        assertEquals(0, BigDecimal.ONE.compareTo(movements.getValue().get(0).getQuantityChange()));

        ArgumentCaptor<PostingRequest> posted = ArgumentCaptor.forClass(PostingRequest.class);
        verify(ledgerService).post(posted.capture());
        PostingRequest request = posted.getValue();
        assertTrue(request.isBalanced());
        assertEquals(new BigDecimal("25.00"), lineFor(request, mapped.get(WellKnownAccount.SALES_REVENUE)).getDebit());
        assertEquals(new BigDecimal("25.00"), lineFor(request, mapped.get(WellKnownAccount.ACCOUNTS_RECEIVABLE)).getCredit());
        assertEquals(invoice.getCustomerId(), request.getCustomerId());
        assertEquals(DocumentType.CREDIT_NOTE, request.getDocumentType());
    }

    @Test
    @DisplayName("Returning more than was sold is refused before anything is written")
    void overReturn() {
        givenInvoice("25.00");
        givenAccounts();

        assertThrows(ValidationException.class, () -> creditNoteService.create(scope, returning("5")));

        verifyNoInteractions(documentNumberService, stockService, ledgerService, creditNoteRepository);
    }

    @Test
    @DisplayName("A written-off invoice cannot take a credit note")
    void writtenOffInvoice() {
        givenInvoice("25.00");
        invoice.writeOff();

        ValidationException error = assertThrows(ValidationException.class,
            () -> creditNoteService.create(scope, returning("1")));

        assertTrue(error.getMessage().contains("written off"));
        assertEquals(0, BigDecimal.ZERO.compareTo(item.getReturnedQuantity()));
        verifyNoInteractions(postingConfiguration, documentNumberService, stockService, ledgerService,
            creditNoteRepository);
    }

    @Test
    @DisplayName("Returning a zero-priced line restocks the goods without a ledger posting")
    void zeroValueReturn() {
        givenInvoice("0.00");
        givenAccounts();
        when(documentNumberService.next(scope.getBusinessId(), DocumentType.CREDIT_NOTE)).thenReturn("CN-00002");
        when(creditNoteRepository.save(any(CreditNote.class))).thenAnswer(invocation -> invocation.getArgument(0));

        CreditNote note = creditNoteService.create(scope, returning("2"));

        assertEquals(new BigDecimal("0.00"), note.getTotalAmount());
        verify(stockService).apply(eq(scope), any());
        verify(ledgerService, never()).post(any());
    }
}
