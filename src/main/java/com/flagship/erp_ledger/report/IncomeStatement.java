package com.flagship.erp_ledger.report;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
public class IncomeStatement {
    LocalDate startDate;
    LocalDate endDate;
    List<StatementLine> revenue;
    List<StatementLine> expenses;
    BigDecimal totalRevenue;
    BigDecimal totalExpenses;

    public BigDecimal getNetIncome() {
        return totalRevenue.subtract(totalExpenses);
    }
}
