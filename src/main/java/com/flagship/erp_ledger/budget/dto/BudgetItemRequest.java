package com.flagship.erp_ledger.budget.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class BudgetItemRequest {

    @NotNull(message = "Account is required")
    UUID accountId;

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.00", message = "Amount must not be negative")
    BigDecimal amount;

    @Min(1)
    @Max(12)
    Integer month;
}
