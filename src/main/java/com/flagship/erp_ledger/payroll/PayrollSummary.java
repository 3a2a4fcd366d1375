package com.flagship.erp_ledger.payroll;

import com.flagship.erp_ledger.common.Money;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.function.Function;

@Value
public class PayrollSummary {
    LocalDate periodStart;
    LocalDate periodEnd;
    int payslipCount;
    int paidCount;
    BigDecimal totalGross;
    BigDecimal totalPaye;
    BigDecimal totalPension;
    BigDecimal totalDeductions;
    BigDecimal totalNet;

    public static PayrollSummary of(LocalDate periodStart, LocalDate periodEnd, List<Payslip> payslips) {
        return new PayrollSummary(periodStart, periodEnd, payslips.size(),
            (int) payslips.stream().filter(Payslip::isPaid).count(),
            total(payslips, Payslip::getGrossPay),
            total(payslips, Payslip::getPayeDeduction),
            total(payslips, Payslip::getPensionDeduction),
            total(payslips, Payslip::getTotalDeductions),
            total(payslips, Payslip::getNetPay));
    }

    private static BigDecimal total(List<Payslip> payslips, Function<Payslip, BigDecimal> field) {
        return Money.sum(payslips.stream().map(field).toList());
    }
}
