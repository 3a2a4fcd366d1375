package com.flagship.erp_ledger.banking.dto;

import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.ledger.LedgerEntry;
import com.flagship.erp_ledger.ledger.dto.LedgerEntryResponse;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class BankTransactionResponse {
    UUID documentId;
    DocumentType documentType;
    List<LedgerEntryResponse> entries;

    public static BankTransactionResponse of(UUID documentId, DocumentType documentType, List<LedgerEntry> entries) {
        return new BankTransactionResponse(documentId, documentType,
            entries.stream().map(LedgerEntryResponse::from).toList());
    }
}
