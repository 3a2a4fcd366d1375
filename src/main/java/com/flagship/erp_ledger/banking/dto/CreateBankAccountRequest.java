package com.flagship.erp_ledger.banking.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class CreateBankAccountRequest {

    @NotBlank(message = "Account name is required")
    @Size(max = 100)
    String accountName;

    @Size(max = 100)
    String bankName;

    @Size(max = 50)
    String accountNumber;

    @Size(min = 3, max = 3, message = "Currency must be a 3-letter code")
    String currency;

    @NotNull(message = "A bank account must be linked to a chart account")
    UUID chartAccountId;
}
