package com.flagship.erp_ledger.payroll.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
public class PayslipPaymentRequest {

    @NotNull(message = "Payment account is required")
    UUID paymentAccountId;

    LocalDate paidDate;
}
