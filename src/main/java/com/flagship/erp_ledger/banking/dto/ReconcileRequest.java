package com.flagship.erp_ledger.banking.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class ReconcileRequest {

    @NotNull(message = "Statement balance is required")
    BigDecimal statementBalance;

    LocalDate statementDate;
}
