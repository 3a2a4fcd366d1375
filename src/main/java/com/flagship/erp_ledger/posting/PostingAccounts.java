package com.flagship.erp_ledger.posting;

import com.flagship.erp_ledger.common.exception.ConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolved well-known accounts of one tenant. Immutable.
 */
public final class PostingAccounts {

    private final UUID businessId;
    private final Map<WellKnownAccount, UUID> accounts;

    public PostingAccounts(UUID businessId, Map<WellKnownAccount, UUID> accounts) {
        this.businessId = businessId;
        EnumMap<WellKnownAccount, UUID> copy = new EnumMap<>(WellKnownAccount.class);
        copy.putAll(accounts);
        this.accounts = Collections.unmodifiableMap(copy);
    }

    /**
     * @throws ConfigurationException when the tenant has no account mapped to the role
     */
    public UUID require(WellKnownAccount role) {
        UUID accountId = accounts.get(role);
        if (accountId == null) {
            throw new ConfigurationException(String.format(
                "No %s account is configured for business %s (expected an account named '%s')",
                role, businessId, role.getDefaultName()));
        }
        return accountId;
    }

    /**
     * Fails fast before a document is written when any of the roles it will post to is unmapped.
     */
    public void requireAll(WellKnownAccount... roles) {
        for (WellKnownAccount role : roles) {
            require(role);
        }
    }

    public Optional<UUID> find(WellKnownAccount role) {
        return Optional.ofNullable(accounts.get(role));
    }

    public boolean isComplete() {
        return accounts.size() == WellKnownAccount.values().length;
    }

    public UUID getBusinessId() {
        return businessId;
    }

    public Map<WellKnownAccount, UUID> asMap() {
        return accounts;
    }
}
