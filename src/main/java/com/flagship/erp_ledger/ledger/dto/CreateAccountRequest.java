package com.flagship.erp_ledger.ledger.dto;

import com.flagship.erp_ledger.ledger.AccountType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

@Value
public class CreateAccountRequest {

    @NotBlank(message = "Account code is required")
    @Size(max = 20)
    String code;

    @NotBlank(message = "Account name is required")
    @Size(max = 100)
    String name;

    @NotNull(message = "Account type is required")
    AccountType accountType;

    UUID parentId;

    String description;
}
