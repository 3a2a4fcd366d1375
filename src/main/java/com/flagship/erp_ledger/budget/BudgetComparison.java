package com.flagship.erp_ledger.budget;

import com.flagship.erp_ledger.common.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Value
public class BudgetComparison {
    UUID budgetId;
    String name;
    int fiscalYear;
    List<BudgetLine> lines;
    BigDecimal totalBudgeted;
    BigDecimal totalActual;
    BigDecimal totalVariance;

    public static BudgetComparison of(Budget budget, List<BudgetLine> lines) {
        BigDecimal budgeted = Money.sum(lines.stream().map(BudgetLine::getBudgeted).toList());
        BigDecimal actual = Money.sum(lines.stream().map(BudgetLine::getActual).toList());
        return new BudgetComparison(budget.getId(), budget.getName(), budget.getFiscalYear(), lines,
            budgeted, actual, budgeted.subtract(actual));
    }
}
