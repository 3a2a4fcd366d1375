package com.flagship.erp_ledger.banking;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class BalanceConsistency {
    UUID bankAccountId;
    UUID chartAccountId;
    BigDecimal currentBalance;
    BigDecimal ledgerBalance;

    public boolean isConsistent() {
        return currentBalance.compareTo(ledgerBalance) == 0;
    }
}
