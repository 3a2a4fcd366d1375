package com.flagship.erp_ledger.ledger.dto;

import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.ledger.EntryType;
import com.flagship.erp_ledger.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResponse {
    UUID id;
    UUID accountId;
    LocalDate transactionDate;
    String description;
    BigDecimal debit;
    BigDecimal credit;
    EntryType entryType;
    DocumentType documentType;
    UUID documentId;
    String documentNumber;
    Long sequenceNumber;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .accountId(entry.getAccountId())
            .transactionDate(entry.getTransactionDate())
            .description(entry.getDescription())
            .debit(entry.getDebit())
            .credit(entry.getCredit())
            .entryType(entry.getEntryType())
            .documentType(entry.getDocumentType())
            .documentId(entry.getDocumentId())
            .documentNumber(entry.getDocumentNumber())
            .sequenceNumber(entry.getSequenceNumber())
            .build();
    }
}
