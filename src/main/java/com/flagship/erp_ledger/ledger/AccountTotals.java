package com.flagship.erp_ledger.ledger;

import com.flagship.erp_ledger.common.Money;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Debit and credit turnover of an account over some period.
 */
@Value
public class AccountTotals {
    public static final AccountTotals ZERO = new AccountTotals(Money.ZERO, Money.ZERO);

    BigDecimal debitTotal;
    BigDecimal creditTotal;

    public BigDecimal getRawBalance() {
        return debitTotal.subtract(creditTotal);
    }

    public boolean isEmpty() {
        return debitTotal.signum() == 0 && creditTotal.signum() == 0;
    }
}
