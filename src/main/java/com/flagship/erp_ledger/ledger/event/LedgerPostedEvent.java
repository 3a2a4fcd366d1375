package com.flagship.erp_ledger.ledger.event;

import com.flagship.erp_ledger.ledger.LedgerEntry;
import com.flagship.erp_ledger.ledger.PostingRequest;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Published through the outbox after a document's entries are committed to the ledger.
 */
@Value
@Builder
public class LedgerPostedEvent {

    public static final String EVENT_TYPE = "LedgerPosted";

    UUID businessId;
    UUID branchId;
    String documentType;
    UUID documentId;
    String documentNumber;
    LocalDate transactionDate;
    BigDecimal totalAmount;
    int entryCount;
    Instant postedAt;

    public static LedgerPostedEvent from(PostingRequest request, List<LedgerEntry> entries) {
        return LedgerPostedEvent.builder()
            .businessId(request.getBusinessId())
            .branchId(request.getBranchId())
            .documentType(request.getDocumentType().name())
            .documentId(request.getDocumentId())
            .documentNumber(request.getDocumentNumber())
            .transactionDate(request.getTransactionDate())
            .totalAmount(request.getDebitTotal())
            .entryCount(entries.size())
            .postedAt(Instant.now())
            .build();
    }
}
