package com.flagship.erp_ledger.budget;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One budget item against the ledger activity of its period. {@code variance = budgeted - actual}.
 */
@Value
public class BudgetLine {
    UUID accountId;
    String accountCode;
    String accountName;
    Integer month;
    BigDecimal budgeted;
    BigDecimal actual;
    BigDecimal variance;

    public static BudgetLine of(UUID accountId, String accountCode, String accountName, Integer month,
                                BigDecimal budgeted, BigDecimal actual) {
        return new BudgetLine(accountId, accountCode, accountName, month, budgeted, actual, budgeted.subtract(actual));
    }
}
