package com.flagship.erp_ledger.banking.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Deposit into or withdrawal from a bank account against a counter account.
 */
@Value
@Builder
public class BankTransactionRequest {

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than zero")
    BigDecimal amount;

    @NotNull(message = "Counter account is required")
    UUID counterAccountId;

    LocalDate transactionDate;

    String description;
}
