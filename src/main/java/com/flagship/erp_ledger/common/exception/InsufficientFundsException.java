package com.flagship.erp_ledger.common.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class InsufficientFundsException extends ValidationException {

    private final BigDecimal available;
    private final BigDecimal requested;

    public InsufficientFundsException(String accountName, BigDecimal available, BigDecimal requested) {
        super("INSUFFICIENT_FUNDS", String.format(
                "Insufficient funds in %s: available=%s, requested=%s", accountName, available, requested));
        this.available = available;
        this.requested = requested;
    }
}
