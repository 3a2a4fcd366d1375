package com.flagship.erp_ledger.common.exception;

import java.util.UUID;

/**
 * The resource does not exist, or belongs to another tenant.
 */
public class NotFoundException extends ErpException {

    public NotFoundException(String message) {
        super("NOT_FOUND", message);
    }

    public static NotFoundException of(String resource, UUID id) {
        return new NotFoundException(resource + " not found: " + id);
    }
}
