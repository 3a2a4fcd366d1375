package com.flagship.erp_ledger.ledger;

import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.exception.NotFoundException;
import com.flagship.erp_ledger.common.exception.UnbalancedPostingException;
import com.flagship.erp_ledger.common.exception.ValidationException;
import com.flagship.erp_ledger.observability.PostingMetrics;
import com.flagship.erp_ledger.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * A posting is validated in full before the first entry is written.
 */
@ExtendWith(MockitoExtension.class)
class LedgerServiceTest {

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private LedgerRepository ledgerRepository;

    @Mock
    private LedgerPostingListener listener;

    @Mock
    private OutboxService outboxService;

    @Mock
    private PostingMetrics postingMetrics;

    private LedgerService ledgerService;

    private final UUID businessId = UUID.randomUUID();
    private final UUID cashId = UUID.randomUUID();
    private final UUID revenueId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        ledgerService = new LedgerService(accountRepository, ledgerRepository, List.of(listener),
            outboxService, postingMetrics);
    }

    private Account account(UUID id, AccountType type, boolean active) {
        return Account.builder()
            .id(id)
            .businessId(businessId)
            .code(id.toString().substring(0, 4))
            .name("Account " + type)
            .type(type)
            .active(active)
            .build();
    }

    private PostingRequest request(String debit, String credit) {
        return PostingRequest.builder()
            .businessId(businessId)
            .transactionDate(LocalDate.of(2024, 5, 1))
            .documentType(DocumentType.JOURNAL_VOUCHER)
            .documentId(UUID.randomUUID())
            .documentNumber("JV-00001")
            .description("Cash sale")
            .line(PostingLine.debit(cashId, new BigDecimal(debit), null))
            .line(PostingLine.credit(revenueId, new BigDecimal(credit), null))
            .build();
    }

    @Test
    @DisplayName("Balanced posting writes every line, notifies listeners and records an outbox event")
    void balancedPosting() {
        // Given
        when(accountRepository.findAllById(eq(businessId), anyCollection())).thenReturn(List.of(
            account(cashId, AccountType.ASSET, true), account(revenueId, AccountType.REVENUE, true)));
        AtomicLong sequence = new AtomicLong();
        when(ledgerRepository.insert(any(LedgerEntry.class))).thenAnswer(invocation -> {
            LedgerEntry entry = invocation.getArgument(0);
            return LedgerEntry.builder()
                .id(entry.getId())
                .businessId(entry.getBusinessId())
                .accountId(entry.getAccountId())
                .transactionDate(entry.getTransactionDate())
                .description(entry.getDescription())
                .debit(entry.getDebit())
                .credit(entry.getCredit())
                .documentType(entry.getDocumentType())
                .documentId(entry.getDocumentId())
                .documentNumber(entry.getDocumentNumber())
                .sequenceNumber(sequence.incrementAndGet())
                .build();
        });
        PostingRequest request = request("150.00", "150.00");

        // When
        List<LedgerEntry> written = ledgerService.post(request);

        // Then
        assertEquals(2, written.size());
        assertEquals(new BigDecimal("150.00"), written.get(0).getDebit());
        assertEquals("Cash sale", written.get(0).getDescription());
        assertEquals(new BigDecimal("150.00"), written.get(1).getCredit());
        verify(listener).onPosted(request, written);
        verify(outboxService).saveEvent(eq("JOURNAL_VOUCHER"), eq(request.getDocumentId()), eq("LedgerPosted"), any());
    }

    @Test
    @DisplayName("Unbalanced posting is rejected without touching the ledger")
    void unbalancedPosting() {
        assertThrows(UnbalancedPostingException.class, () -> ledgerService.post(request("100.00", "99.99")));

        verifyNoInteractions(ledgerRepository, listener, outboxService);
        verify(postingMetrics).recordPostingRejected(DocumentType.JOURNAL_VOUCHER, "UNBALANCED_POSTING");
    }

    @Test
    @DisplayName("A line with more than two decimals is rejected")
    void tooManyDecimals() {
        assertThrows(ValidationException.class, () -> ledgerService.post(request("10.005", "10.005")));

        verifyNoInteractions(ledgerRepository);
    }

    @Test
    @DisplayName("A single-line posting is rejected")
    void singleLine() {
        PostingRequest request = PostingRequest.builder()
            .businessId(businessId)
            .transactionDate(LocalDate.now())
            .documentType(DocumentType.JOURNAL_VOUCHER)
            .documentId(UUID.randomUUID())
            .line(PostingLine.debit(cashId, BigDecimal.TEN, null))
            .build();

        assertThrows(ValidationException.class, () -> ledgerService.post(request));
        verifyNoInteractions(ledgerRepository);
    }

    @Test
    @DisplayName("An inactive account fails the whole posting before any insert")
    void inactiveAccount() {
        when(accountRepository.findAllById(eq(businessId), anyCollection())).thenReturn(List.of(
            account(cashId, AccountType.ASSET, true), account(revenueId, AccountType.REVENUE, false)));

        assertThrows(ValidationException.class, () -> ledgerService.post(request("50.00", "50.00")));

        verify(ledgerRepository, never()).insert(any());
        verify(outboxService, never()).saveEvent(anyString(), any(), anyString(), any());
    }

    @Test
    @DisplayName("An account of another business is reported as not found")
    void unknownAccount() {
        when(accountRepository.findAllById(eq(businessId), anyCollection()))
            .thenReturn(List.of(account(cashId, AccountType.ASSET, true)));

        assertThrows(NotFoundException.class, () -> ledgerService.post(request("50.00", "50.00")));
        verify(ledgerRepository, never()).insert(any());
    }

    @Test
    @DisplayName("A net-form line carrying both a debit and a credit is posted when the request balances")
    void netFormLine() {
        // Given
        when(accountRepository.findAllById(eq(businessId), anyCollection())).thenReturn(List.of(
            account(cashId, AccountType.ASSET, true), account(revenueId, AccountType.REVENUE, true)));
        when(ledgerRepository.insert(any(LedgerEntry.class))).thenAnswer(invocation -> invocation.getArgument(0));
        PostingRequest request = PostingRequest.builder()
            .businessId(businessId)
            .transactionDate(LocalDate.of(2024, 5, 2))
            .documentType(DocumentType.JOURNAL_VOUCHER)
            .documentId(UUID.randomUUID())
            .documentNumber("JV-00002")
            .line(PostingLine.of(cashId, new BigDecimal("10.00"), new BigDecimal("5.00"), null))
            .line(PostingLine.credit(revenueId, new BigDecimal("5.00"), null))
            .build();

        // When
        List<LedgerEntry> written = ledgerService.post(request);

        // Then
        assertEquals(2, written.size());
        assertEquals(new BigDecimal("10.00"), written.get(0).getDebit());
        assertEquals(new BigDecimal("5.00"), written.get(0).getCredit());
        assertEquals(new BigDecimal("5.00"), written.get(0).getNet());
        assertEquals(EntryType.DEBIT, written.get(0).getEntryType());
        assertEquals(EntryType.CREDIT, written.get(1).getEntryType());
    }

    @Test
    @DisplayName("A line with neither a debit nor a credit is rejected")
    void zeroLine() {
        PostingRequest request = PostingRequest.builder()
            .businessId(businessId)
            .transactionDate(LocalDate.of(2024, 5, 3))
            .documentType(DocumentType.JOURNAL_VOUCHER)
            .documentId(UUID.randomUUID())
            .line(PostingLine.debit(cashId, new BigDecimal("20.00"), null))
            .line(PostingLine.credit(revenueId, new BigDecimal("20.00"), null))
            .line(PostingLine.of(revenueId, BigDecimal.ZERO, BigDecimal.ZERO, null))
            .build();

        assertThrows(ValidationException.class, () -> ledgerService.post(request));
        verifyNoInteractions(accountRepository, ledgerRepository, outboxService);
    }
}
