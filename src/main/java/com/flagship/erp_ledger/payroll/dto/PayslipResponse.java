package com.flagship.erp_ledger.payroll.dto;

import com.flagship.erp_ledger.payroll.Payslip;
import com.flagship.erp_ledger.payroll.PayslipStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class PayslipResponse {
    UUID id;
    String payslipNumber;
    UUID employeeId;
    LocalDate periodStart;
    LocalDate periodEnd;
    BigDecimal basicSalary;
    BigDecimal allowances;
    BigDecimal grossPay;
    BigDecimal payeDeduction;
    BigDecimal pensionDeduction;
    BigDecimal otherDeductions;
    BigDecimal totalDeductions;
    BigDecimal netPay;
    PayslipStatus status;
    LocalDate paidDate;
    UUID paymentAccountId;

    public static PayslipResponse from(Payslip payslip) {
        return PayslipResponse.builder()
            .id(payslip.getId())
            .payslipNumber(payslip.getPayslipNumber())
            .employeeId(payslip.getEmployeeId())
            .periodStart(payslip.getPeriodStart())
            .periodEnd(payslip.getPeriodEnd())
            .basicSalary(payslip.getBasicSalary())
            .allowances(payslip.getAllowances())
            .grossPay(payslip.getGrossPay())
            .payeDeduction(payslip.getPayeDeduction())
            .pensionDeduction(payslip.getPensionDeduction())
            .otherDeductions(payslip.getOtherDeductions())
            .totalDeductions(payslip.getTotalDeductions())
            .netPay(payslip.getNetPay())
            .status(payslip.getStatus())
            .paidDate(payslip.getPaidDate())
            .paymentAccountId(payslip.getPaymentAccountId())
            .build();
    }
}
