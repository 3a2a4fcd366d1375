package com.flagship.erp_ledger.payroll.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class CreatePayslipRequest {

    @NotNull(message = "Employee is required")
    UUID employeeId;

    @NotNull(message = "Period start is required")
    LocalDate periodStart;

    @NotNull(message = "Period end is required")
    LocalDate periodEnd;

    @DecimalMin("0.00")
    BigDecimal extraDeductions;

    @DecimalMin("0.00")
    BigDecimal extraAllowances;
}
