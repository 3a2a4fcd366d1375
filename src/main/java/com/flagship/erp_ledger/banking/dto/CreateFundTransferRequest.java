package com.flagship.erp_ledger.banking.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class CreateFundTransferRequest {

    @NotNull(message = "Source account is required")
    UUID fromAccountId;

    @NotNull(message = "Destination account is required")
    UUID toAccountId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than zero")
    BigDecimal amount;

    @NotNull(message = "Transfer date is required")
    LocalDate transferDate;

    String description;

    @Size(max = 100)
    String reference;
}
