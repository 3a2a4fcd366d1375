package com.flagship.erp_ledger.payroll.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.LocalDate;

@Value
public class PayrollPeriodRequest {

    @NotNull(message = "Period start is required")
    LocalDate periodStart;

    @NotNull(message = "Period end is required")
    LocalDate periodEnd;
}
