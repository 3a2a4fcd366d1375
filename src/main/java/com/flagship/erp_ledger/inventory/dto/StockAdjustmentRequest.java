package com.flagship.erp_ledger.inventory.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class StockAdjustmentRequest {
    @NotNull(message = "Quantity change is required")
    BigDecimal quantityChange;
    String reason;
}
