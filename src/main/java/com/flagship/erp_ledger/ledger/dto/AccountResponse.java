package com.flagship.erp_ledger.ledger.dto;

import com.flagship.erp_ledger.ledger.Account;
import com.flagship.erp_ledger.ledger.AccountType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {
    UUID id;
    String code;
    String name;
    AccountType accountType;
    UUID parentId;
    String description;
    boolean active;
    boolean systemAccount;
    Instant createdAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .code(account.getCode())
            .name(account.getName())
            .accountType(account.getType())
            .parentId(account.getParentId())
            .description(account.getDescription())
            .active(account.isActive())
            .systemAccount(account.isSystemAccount())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
