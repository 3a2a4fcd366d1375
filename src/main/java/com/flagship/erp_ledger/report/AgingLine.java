package com.flagship.erp_ledger.report;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class AgingLine {
    UUID documentId;
    String documentNumber;
    UUID counterpartyId;
    LocalDate dueDate;
    BigDecimal totalAmount;
    BigDecimal paidAmount;
    BigDecimal outstanding;
    long daysOverdue;
    AgingBucket bucket;
}
