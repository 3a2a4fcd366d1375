package com.flagship.erp_ledger.common.exception;

/**
 * A request that violates a business rule. Nothing has been written when this is thrown.
 */
public class ValidationException extends ErpException {

    public static final String CODE = "VALIDATION_FAILED";

    public ValidationException(String message) {
        super(CODE, message);
    }

    protected ValidationException(String errorCode, String message) {
        super(errorCode, message);
    }
}
