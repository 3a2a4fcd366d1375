package com.flagship.erp_ledger.inventory.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class CreateProductRequest {

    @NotBlank(message = "Product name is required")
    @Size(max = 100)
    String name;

    @Size(max = 50)
    String sku;

    @Size(max = 20)
    String unit;

    @DecimalMin(value = "0.00", message = "Purchase price must not be negative")
    BigDecimal purchasePrice;

    @DecimalMin(value = "0.00", message = "Sales price must not be negative")
    BigDecimal salesPrice;

    @DecimalMin(value = "0.00", message = "Opening stock must not be negative")
    BigDecimal openingStock;

    @DecimalMin(value = "0.00")
    BigDecimal reorderLevel;
}
