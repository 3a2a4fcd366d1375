package com.flagship.erp_ledger.payroll;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PayrollBreakdown {
    BigDecimal basicSalary;
    BigDecimal allowances;
    BigDecimal grossPay;
    BigDecimal payeDeduction;
    BigDecimal pensionDeduction;
    BigDecimal otherDeductions;
    BigDecimal totalDeductions;
    BigDecimal netPay;
}
