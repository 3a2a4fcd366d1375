package com.flagship.erp_ledger.ledger;

import com.flagship.erp_ledger.common.DocumentType;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A set of ledger lines produced by one source document.
 *
 * Invariant: sum of debits equals sum of credits. {@link LedgerService#post(PostingRequest)} refuses
 * anything else.
 */
@Value
@Builder
public class PostingRequest {
    UUID businessId;
    UUID branchId;
    LocalDate transactionDate;
    String description;
    DocumentType documentType;
    UUID documentId;
    String documentNumber;
    UUID customerId;
    UUID vendorId;
    @Singular
    List<PostingLine> lines;

    public BigDecimal getDebitTotal() {
        return lines.stream()
            .map(PostingLine::getDebit)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getCreditTotal() {
        return lines.stream()
            .map(PostingLine::getCredit)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public boolean hasLines() {
        return !lines.isEmpty();
    }

    public boolean isBalanced() {
        return getDebitTotal().compareTo(getCreditTotal()) == 0;
    }
}
