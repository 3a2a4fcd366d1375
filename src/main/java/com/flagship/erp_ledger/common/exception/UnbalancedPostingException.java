package com.flagship.erp_ledger.common.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class UnbalancedPostingException extends ValidationException {

    private final BigDecimal totalDebits;
    private final BigDecimal totalCredits;

    public UnbalancedPostingException(BigDecimal totalDebits, BigDecimal totalCredits) {
        super("UNBALANCED_POSTING", String.format(
                "Debits must equal credits: debits=%s, credits=%s, difference=%s",
                totalDebits, totalCredits, totalDebits.subtract(totalCredits).abs()));
        this.totalDebits = totalDebits;
        this.totalCredits = totalCredits;
    }
}
