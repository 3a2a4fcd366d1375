package com.flagship.erp_ledger.purchase.dto;

import com.flagship.erp_ledger.common.dto.DocumentItemRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class CreateBillRequest {

    /**
     * Supplier's own bill number; a PO- number is drawn when absent.
     */
    @Size(max = 50)
    String billNumber;

    @NotNull(message = "Vendor is required")
    UUID vendorId;

    @NotNull(message = "Bill date is required")
    LocalDate billDate;

    LocalDate dueDate;

    String notes;

    @DecimalMin(value = "0.00", message = "VAT rate must not be negative")
    @DecimalMax(value = "100.00", message = "VAT rate must not exceed 100")
    BigDecimal vatRate;

    @NotEmpty(message = "A bill needs at least one item")
    @Singular
    List<@Valid DocumentItemRequest> items;
}
