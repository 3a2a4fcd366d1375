package com.flagship.erp_ledger.ledger;

import com.flagship.erp_ledger.common.DocumentType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One immutable line in the ledger. Exactly one of debit and credit is positive.
 */
@Value
@Builder
public class LedgerEntry {
    UUID id;
    UUID businessId;
    UUID branchId;
    UUID accountId;
    LocalDate transactionDate;
    String description;
    BigDecimal debit;
    BigDecimal credit;
    DocumentType documentType;
    UUID documentId;
    String documentNumber;
    UUID customerId;
    UUID vendorId;
    Long sequenceNumber;
    Instant createdAt;

    /**
     * Signed effect on the raw (debit minus credit) balance.
     */
    public BigDecimal getNet() {
        return debit.subtract(credit);
    }

    /**
     * The dominant side; a net-form line that carries both amounts reports the larger one.
     */
    public EntryType getEntryType() {
        return debit.compareTo(credit) >= 0 ? EntryType.DEBIT : EntryType.CREDIT;
    }
}
