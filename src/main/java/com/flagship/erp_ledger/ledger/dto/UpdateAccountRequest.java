package com.flagship.erp_ledger.ledger.dto;

import com.flagship.erp_ledger.ledger.AccountType;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Partial update: null fields are left unchanged.
 */
@Value
@Builder
public class UpdateAccountRequest {
    @Size(max = 20)
    String code;
    @Size(max = 100)
    String name;
    AccountType accountType;
    UUID parentId;
    String description;
    Boolean active;
}
