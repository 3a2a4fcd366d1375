package com.flagship.erp_ledger.common;

import com.flagship.erp_ledger.common.exception.ValidationException;
import lombok.Value;

import java.util.Objects;
import java.util.UUID;

/**
 * Tenant context of a request, resolved from the X-Business-ID, X-Branch-ID and X-User-ID headers.
 *
 * Every repository query and every mutation is filtered by {@link #getBusinessId()}.
 */
@Value
public class TenantScope {

    public static final String BUSINESS_HEADER = "X-Business-ID";
    public static final String BRANCH_HEADER = "X-Branch-ID";
    public static final String USER_HEADER = "X-User-ID";

    UUID businessId;
    UUID branchId;
    UUID userId;

    public static TenantScope of(UUID businessId, UUID branchId, UUID userId) {
        Objects.requireNonNull(businessId, "businessId must not be null");
        return new TenantScope(businessId, branchId, userId);
    }

    public static TenantScope of(UUID businessId, UUID branchId) {
        return of(businessId, branchId, null);
    }

    /**
     * Branch of the current request; branch-scoped mutations cannot proceed without one.
     */
    public UUID requireBranch() {
        if (branchId == null) {
            throw new ValidationException("Header " + BRANCH_HEADER + " is required for this operation");
        }
        return branchId;
    }
}
