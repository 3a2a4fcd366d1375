package com.flagship.erp_ledger.report;

import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.ledger.LedgerEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeneralLedgerTest {

    private final UUID accountId = UUID.randomUUID();

    private LedgerEntry entry(long sequence, String debit, String credit) {
        return LedgerEntry.builder()
            .id(UUID.randomUUID())
            .accountId(accountId)
            .transactionDate(LocalDate.of(2024, 2, 1))
            .debit(new BigDecimal(debit))
            .credit(new BigDecimal(credit))
            .documentType(DocumentType.JOURNAL_VOUCHER)
            .documentId(UUID.randomUUID())
            .sequenceNumber(sequence)
            .build();
    }

    @Test
    @DisplayName("Running balance folds debit minus credit from the opening balance")
    void foldsFromOpeningBalance() {
        List<LedgerEntry> entries = List.of(
            entry(1, "100.00", "0.00"),
            entry(2, "0.00", "30.00"),
            entry(3, "5.50", "0.00"));

        GeneralLedger ledger = GeneralLedger.fold(accountId, LocalDate.of(2024, 2, 1), null,
            new BigDecimal("20.00"), entries);

        assertEquals(new BigDecimal("120.00"), ledger.getLines().get(0).getRunningBalance());
        assertEquals(new BigDecimal("90.00"), ledger.getLines().get(1).getRunningBalance());
        assertEquals(new BigDecimal("95.50"), ledger.getLines().get(2).getRunningBalance());
        assertEquals(new BigDecimal("95.50"), ledger.getClosingBalance());
    }

    @Test
    @DisplayName("No entries leaves the opening balance as closing balance")
    void emptyLedger() {
        GeneralLedger ledger = GeneralLedger.fold(accountId, null, null, BigDecimal.ZERO, List.of());

        assertTrue(ledger.getLines().isEmpty());
        assertEquals(new BigDecimal("0.00"), ledger.getClosingBalance());
    }
}
