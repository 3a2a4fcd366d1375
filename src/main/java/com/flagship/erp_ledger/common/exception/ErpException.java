package com.flagship.erp_ledger.common.exception;

import lombok.Getter;

/**
 * Root of the domain error taxonomy. Each subclass carries a stable error code that is returned to API
 * clients alongside the HTTP status chosen by {@link GlobalExceptionHandler}.
 */
@Getter
public abstract class ErpException extends RuntimeException {

    private final String errorCode;

    protected ErpException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected ErpException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
