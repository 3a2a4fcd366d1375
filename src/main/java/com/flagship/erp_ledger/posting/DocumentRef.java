package com.flagship.erp_ledger.posting;

import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.ledger.PostingRequest;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Identity of the document a posting belongs to; copied onto every entry of the posting.
 */
@Value
@Builder
public class DocumentRef {
    UUID businessId;
    UUID branchId;
    DocumentType documentType;
    UUID documentId;
    String documentNumber;
    LocalDate transactionDate;
    UUID customerId;
    UUID vendorId;

    PostingRequest.PostingRequestBuilder toRequest(String description) {
        return PostingRequest.builder()
            .businessId(businessId)
            .branchId(branchId)
            .documentType(documentType)
            .documentId(documentId)
            .documentNumber(documentNumber)
            .transactionDate(transactionDate)
            .customerId(customerId)
            .vendorId(vendorId)
            .description(description);
    }
}
