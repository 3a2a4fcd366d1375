package com.flagship.erp_ledger.purchase;

import com.flagship.erp_ledger.banking.BankAccountService;
import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.dto.DocumentItemRequest;
import com.flagship.erp_ledger.common.exception.ValidationException;
import com.flagship.erp_ledger.inventory.StockService;
import com.flagship.erp_ledger.ledger.AccountService;
import com.flagship.erp_ledger.ledger.LedgerService;
import com.flagship.erp_ledger.posting.DocumentNumberService;
import com.flagship.erp_ledger.posting.PostingAccounts;
import com.flagship.erp_ledger.posting.PostingConfigurationService;
import com.flagship.erp_ledger.posting.PostingRules;
import com.flagship.erp_ledger.posting.WellKnownAccount;
import com.flagship.erp_ledger.purchase.dto.CreateBillRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PurchaseBillServiceTest {

    @Mock
    private PurchaseBillRepository billRepository;

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

    @Mock
    private BankAccountService bankAccountService;

    private PurchaseBillService billService;

    private final TenantScope scope = TenantScope.of(UUID.randomUUID(), UUID.randomUUID());

    @BeforeEach
    void setUp() {
        billService = new PurchaseBillService(billRepository, documentNumberService, postingConfiguration,
            new PostingRules(), ledgerService, stockService, accountService, bankAccountService);
        Map<WellKnownAccount, UUID> mapped = new EnumMap<>(WellKnownAccount.class);
        for (WellKnownAccount role : WellKnownAccount.values()) {
            mapped.put(role, UUID.randomUUID());
        }
        when(postingConfiguration.forTenant(scope.getBusinessId()))
            .thenReturn(new PostingAccounts(scope.getBusinessId(), mapped));
    }

    private static CreateBillRequest bill(String billNumber, String price) {
        return CreateBillRequest.builder()
            .billNumber(billNumber)
            .vendorId(UUID.randomUUID())
            .billDate(LocalDate.of(2024, 5, 1))
            .item(new DocumentItemRequest(UUID.randomUUID(), "Steel sheet", new BigDecimal("5"), new BigDecimal(price)))
            .build();
    }

    @Test
    @DisplayName("A supplier number in the generated PO- shape is refused before stock moves")
    void supplierNumberInGeneratedShape() {
        ValidationException error = assertThrows(ValidationException.class,
            () -> billService.create(scope, bill("PO-00002", "60.00")));

        assertTrue(error.getMessage().contains("PO-00002"));
        verifyNoInteractions(stockService, documentNumberService, ledgerService);
        verify(billRepository, never()).save(any());
    }

    @Test
    @DisplayName("A drawn number that is already taken fails with a validation error instead of a constraint violation")
    void generatedNumberAlreadyTaken() {
        // Given
        when(documentNumberService.next(scope.getBusinessId(), DocumentType.PURCHASE_BILL)).thenReturn("PO-00002");
        when(billRepository.existsByBusinessIdAndBillNumber(scope.getBusinessId(), "PO-00002")).thenReturn(true);

        // When
        ValidationException error = assertThrows(ValidationException.class,
            () -> billService.create(scope, bill(null, "60.00")));

        // Then
        assertEquals("Bill number PO-00002 already exists", error.getMessage());
        verify(billRepository, never()).save(any());
        verifyNoInteractions(ledgerService);
    }

    @Test
    @DisplayName("A zero-priced bill receives stock without posting to the ledger")
    void zeroValueBill() {
        when(billRepository.save(any(PurchaseBill.class))).thenAnswer(invocation -> invocation.getArgument(0));

        PurchaseBill bill = billService.create(scope, bill("SUP-100", "0.00"));

        assertEquals("SUP-100", bill.getBillNumber());
        assertEquals(new BigDecimal("0.00"), bill.getTotalAmount());
        verify(stockService).apply(any(), any());
        verify(ledgerService, never()).post(any());
    }
}
