package com.flagship.erp_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A chart-of-accounts entry owned by one business.
 */
@Value
@Builder(toBuilder = true)
public class Account {
    UUID id;
    UUID businessId;
    String code;
    String name;
    AccountType type;
    UUID parentId;
    String description;
    boolean active;
    boolean systemAccount;
    Instant createdAt;

    public String getDisplayName() {
        return code + " - " + name;
    }
}
