package com.flagship.erp_ledger.report;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Assets against liabilities and equity. Current-period profit is not closed into equity, so the sheet only
 * balances once revenue and expense accounts carry no balance.
 */
@Value
public class BalanceSheet {
    LocalDate asOf;
    List<StatementLine> assets;
    List<StatementLine> liabilities;
    List<StatementLine> equity;
    BigDecimal totalAssets;
    BigDecimal totalLiabilities;
    BigDecimal totalEquity;

    public boolean isBalanced() {
        return totalAssets.compareTo(totalLiabilities.add(totalEquity)) == 0;
    }
}
