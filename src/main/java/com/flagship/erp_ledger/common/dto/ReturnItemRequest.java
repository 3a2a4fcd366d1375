package com.flagship.erp_ledger.common.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Quantity returned against one line of the original invoice or bill.
 */
@Value
public class ReturnItemRequest {

    @NotNull(message = "Original item is required")
    UUID itemId;

    @NotNull(message = "Quantity is required")
    @DecimalMin(value = "0.01", message = "Quantity must be greater than zero")
    BigDecimal quantity;
}
