package com.flagship.erp_ledger.banking;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Book balance against a bank statement; {@code difference} is book minus statement.
 */
@Value
public class Reconciliation {
    UUID bankAccountId;
    LocalDate statementDate;
    BigDecimal bookBalance;
    BigDecimal statementBalance;
    BigDecimal difference;

    public boolean isReconciled() {
        return difference.signum() == 0;
    }
}
