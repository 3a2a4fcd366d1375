package com.flagship.erp_ledger.banking;

import com.flagship.erp_ledger.banking.dto.CreateFundTransferRequest;
import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.InsufficientFundsException;
import com.flagship.erp_ledger.common.exception.ValidationException;
import com.flagship.erp_ledger.ledger.LedgerService;
import com.flagship.erp_ledger.ledger.PostingLine;
import com.flagship.erp_ledger.ledger.PostingRequest;
import com.flagship.erp_ledger.posting.DocumentNumberService;
import com.flagship.erp_ledger.posting.PostingRules;
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
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FundTransferServiceTest {

    @Mock
    private FundTransferRepository transferRepository;

    @Mock
    private BankAccountRepository bankAccountRepository;

    @Mock
    private DocumentNumberService documentNumberService;

    @Mock
    private LedgerService ledgerService;

    private FundTransferService service;

    private final TenantScope scope = TenantScope.of(UUID.randomUUID(), UUID.randomUUID());
    private BankAccount operating;
    private BankAccount payroll;

    @BeforeEach
    void setUp() {
        service = new FundTransferService(transferRepository, bankAccountRepository, documentNumberService,
            new PostingRules(), ledgerService);
        operating = bankAccount("Operating", new BigDecimal("500.00"));
        payroll = bankAccount("Payroll", BigDecimal.ZERO);
    }

    private BankAccount bankAccount(String name, BigDecimal balance) {
        BankAccount account = BankAccount.create(scope, name, "First Bank", null, "NGN", UUID.randomUUID(), balance);
        ReflectionTestUtils.setField(account, "id", UUID.randomUUID());
        return account;
    }

    private CreateFundTransferRequest transfer(BankAccount from, BankAccount to, String amount) {
        return CreateFundTransferRequest.builder()
            .fromAccountId(from.getId())
            .toAccountId(to.getId())
            .amount(new BigDecimal(amount))
            .transferDate(LocalDate.of(2024, 3, 1))
            .build();
    }

    private void stubLocks() {
        when(bankAccountRepository.findForUpdate(operating.getId(), scope.getBusinessId()))
            .thenReturn(Optional.of(operating));
        when(bankAccountRepository.findForUpdate(payroll.getId(), scope.getBusinessId()))
            .thenReturn(Optional.of(payroll));
    }

    @Test
    @DisplayName("Transfer posts Dr destination, Cr source")
    void postsTransfer() {
        // Given
        stubLocks();
        when(documentNumberService.next(scope.getBusinessId(), DocumentType.FUND_TRANSFER)).thenReturn("FT-000001");
        when(transferRepository.save(any(FundTransfer.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        FundTransfer result = service.create(scope, transfer(operating, payroll, "200.00"));

        // Then
        assertEquals("FT-000001", result.getTransferNumber());
        ArgumentCaptor<PostingRequest> posted = ArgumentCaptor.forClass(PostingRequest.class);
        verify(ledgerService).post(posted.capture());
        PostingLine debit = posted.getValue().getLines().get(0);
        PostingLine credit = posted.getValue().getLines().get(1);
        assertEquals(payroll.getChartAccountId(), debit.getAccountId());
        assertEquals(0, new BigDecimal("200.00").compareTo(debit.getDebit()));
        assertEquals(operating.getChartAccountId(), credit.getAccountId());
        assertEquals(0, new BigDecimal("200.00").compareTo(credit.getCredit()));
    }

    @Test
    @DisplayName("Transfer larger than the source balance is rejected before anything is written")
    void insufficientFunds() {
        // Given
        stubLocks();

        // When / Then
        assertThrows(InsufficientFundsException.class,
            () -> service.create(scope, transfer(operating, payroll, "500.01")));
        verifyNoInteractions(documentNumberService);
        verify(transferRepository, never()).save(any());
        verify(ledgerService, never()).post(any());
    }

    @Test
    @DisplayName("Transfer to the same account is rejected")
    void sameAccount() {
        assertThrows(ValidationException.class,
            () -> service.create(scope, transfer(operating, operating, "10.00")));
        verifyNoInteractions(bankAccountRepository, ledgerService);
    }

    @Test
    @DisplayName("Transfer involving an inactive account is rejected")
    void inactiveAccount() {
        // Given
        payroll.deactivate();
        stubLocks();

        // When / Then
        assertThrows(ValidationException.class,
            () -> service.create(scope, transfer(operating, payroll, "10.00")));
        verify(ledgerService, never()).post(any());
    }
}
