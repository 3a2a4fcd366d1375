package com.flagship.erp_ledger.journal.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class JournalLineRequest {

    @NotNull(message = "Account is required")
    UUID accountId;

    @DecimalMin(value = "0.00", message = "Debit must not be negative")
    BigDecimal debit;

    @DecimalMin(value = "0.00", message = "Credit must not be negative")
    BigDecimal credit;

    String description;
}
