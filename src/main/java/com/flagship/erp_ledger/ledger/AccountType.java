package com.flagship.erp_ledger.ledger;

import java.math.BigDecimal;

/**
 * Account classification with its normal balance side.
 *
 * Raw balances are always debit minus credit; credit-normal types report the negation so that a healthy
 * liability, equity or revenue account shows a positive figure.
 */
public enum AccountType {
    ASSET(NormalBalance.DEBIT),
    LIABILITY(NormalBalance.CREDIT),
    EQUITY(NormalBalance.CREDIT),
    REVENUE(NormalBalance.CREDIT),
    EXPENSE(NormalBalance.DEBIT);

    private final NormalBalance normalBalance;

    AccountType(NormalBalance normalBalance) {
        this.normalBalance = normalBalance;
    }

    public NormalBalance getNormalBalance() {
        return normalBalance;
    }

    public boolean isCreditNormal() {
        return normalBalance == NormalBalance.CREDIT;
    }

    public BigDecimal toReported(BigDecimal rawBalance) {
        return isCreditNormal() ? rawBalance.negate() : rawBalance;
    }

    public enum NormalBalance {
        DEBIT,
        CREDIT
    }
}
