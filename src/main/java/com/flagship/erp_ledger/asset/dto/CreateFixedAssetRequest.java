package com.flagship.erp_ledger.asset.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class CreateFixedAssetRequest {

    @NotBlank(message = "Asset name is required")
    @Size(max = 100)
    String name;

    @Size(max = 50)
    String assetCode;

    @NotNull(message = "Purchase date is required")
    LocalDate purchaseDate;

    @NotNull(message = "Purchase cost is required")
    @DecimalMin(value = "0.00", message = "Purchase cost must not be negative")
    BigDecimal purchaseCost;

    @DecimalMin(value = "0.00", message = "Salvage value must not be negative")
    BigDecimal salvageValue;

    @NotNull(message = "Useful life is required")
    @Min(value = 1, message = "Useful life must be at least one year")
    Integer usefulLifeYears;
}
