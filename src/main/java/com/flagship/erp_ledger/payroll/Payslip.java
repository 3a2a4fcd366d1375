package com.flagship.erp_ledger.payroll;

import com.flagship.erp_ledger.common.exception.ValidationException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "payslips")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Payslip {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "business_id", nullable = false, updatable = false)
    private UUID businessId;

    @Column(name = "branch_id", nullable = false, updatable = false)
    private UUID branchId;

    @Column(name = "payslip_number", nullable = false, updatable = false, length = 50)
    private String payslipNumber;

    @Column(name = "employee_id", nullable = false, updatable = false)
    private UUID employeeId;

    @Column(name = "period_start", nullable = false, updatable = false)
    private LocalDate periodStart;

    @Column(name = "period_end", nullable = false, updatable = false)
    private LocalDate periodEnd;

    @Column(name = "basic_salary", nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal basicSalary;

    @Column(name = "allowances", nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal allowances;

    @Column(name = "gross_pay", nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal grossPay;

    @Column(name = "paye_deduction", nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal payeDeduction;

    @Column(name = "pension_deduction", nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal pensionDeduction;

    @Column(name = "other_deductions", nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal otherDeductions;

    @Column(name = "total_deductions", nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal totalDeductions;

    @Column(name = "net_pay", nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal netPay;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PayslipStatus status;

    @Column(name = "paid_date")
    private LocalDate paidDate;

    @Column(name = "payment_account_id")
    private UUID paymentAccountId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static Payslip create(String number, Employee employee, LocalDate periodStart, LocalDate periodEnd,
                                 PayrollBreakdown breakdown) {
        Payslip payslip = new Payslip();
        payslip.businessId = employee.getBusinessId();
        payslip.branchId = employee.getBranchId();
        payslip.payslipNumber = number;
        payslip.employeeId = employee.getId();
        payslip.periodStart = periodStart;
        payslip.periodEnd = periodEnd;
        payslip.basicSalary = breakdown.getBasicSalary();
        payslip.allowances = breakdown.getAllowances();
        payslip.grossPay = breakdown.getGrossPay();
        payslip.payeDeduction = breakdown.getPayeDeduction();
        payslip.pensionDeduction = breakdown.getPensionDeduction();
        payslip.otherDeductions = breakdown.getOtherDeductions();
        payslip.totalDeductions = breakdown.getTotalDeductions();
        payslip.netPay = breakdown.getNetPay();
        payslip.status = PayslipStatus.DRAFT;
        return payslip;
    }

    public boolean isPaid() {
        return status == PayslipStatus.PAID;
    }

    public void markPaid(UUID paymentAccountId, LocalDate paidDate) {
        if (isPaid()) {
            throw new ValidationException("Payslip " + payslipNumber + " is already paid");
        }
        this.status = PayslipStatus.PAID;
        this.paymentAccountId = paymentAccountId;
        this.paidDate = paidDate;
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
    }
}
