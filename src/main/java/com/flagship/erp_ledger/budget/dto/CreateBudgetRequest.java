package com.flagship.erp_ledger.budget.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CreateBudgetRequest {

    @NotBlank(message = "Budget name is required")
    @Size(max = 100)
    String name;

    @NotNull(message = "Fiscal year is required")
    @Min(value = 1900, message = "Fiscal year is out of range")
    Integer fiscalYear;

    String description;

    @Singular
    List<@Valid BudgetItemRequest> items;
}
