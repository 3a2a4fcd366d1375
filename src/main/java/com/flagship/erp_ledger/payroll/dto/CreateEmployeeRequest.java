package com.flagship.erp_ledger.payroll.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class CreateEmployeeRequest {

    @NotBlank(message = "Full name is required")
    @Size(max = 150)
    String fullName;

    @Size(max = 50)
    String employeeCode;

    @Size(max = 100)
    String position;

    @NotNull(message = "Gross salary is required")
    @DecimalMin(value = "0.00", message = "Gross salary must not be negative")
    BigDecimal grossSalary;

    @DecimalMin("0.00")
    @DecimalMax("100.00")
    BigDecimal payeRate;

    @DecimalMin("0.00")
    @DecimalMax("100.00")
    BigDecimal pensionRate;

    @DecimalMin("0.00")
    BigDecimal otherDeductions;

    @DecimalMin("0.00")
    BigDecimal otherAllowances;
}
