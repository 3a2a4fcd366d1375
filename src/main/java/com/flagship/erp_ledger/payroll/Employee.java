package com.flagship.erp_ledger.payroll;

import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.common.TenantScope;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
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
import java.util.UUID;

/**
 * An employee together with the payroll configuration payslips are computed from. Rates are percentages.
 */
@Entity
@Table(name = "employees")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Employee {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "business_id", nullable = false, updatable = false)
    private UUID businessId;

    @Column(name = "branch_id", nullable = false)
    private UUID branchId;

    @Column(name = "full_name", nullable = false, length = 150)
    private String fullName;

    @Column(name = "employee_code", length = 50)
    private String employeeCode;

    @Column(name = "position", length = 100)
    private String position;

    @Column(name = "gross_salary", nullable = false, precision = 15, scale = 2)
    private BigDecimal grossSalary;

    @Column(name = "paye_rate", nullable = false, precision = 5, scale = 2)
    private BigDecimal payeRate;

    @Column(name = "pension_rate", nullable = false, precision = 5, scale = 2)
    private BigDecimal pensionRate;

    @Column(name = "other_deductions", nullable = false, precision = 15, scale = 2)
    private BigDecimal otherDeductions;

    @Column(name = "other_allowances", nullable = false, precision = 15, scale = 2)
    private BigDecimal otherAllowances;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static Employee create(TenantScope scope, String fullName, String employeeCode, String position,
                                  BigDecimal grossSalary, BigDecimal payeRate, BigDecimal pensionRate,
                                  BigDecimal otherDeductions, BigDecimal otherAllowances) {
        Employee employee = new Employee();
        employee.businessId = scope.getBusinessId();
        employee.branchId = scope.requireBranch();
        employee.fullName = fullName;
        employee.employeeCode = employeeCode;
        employee.position = position;
        employee.grossSalary = Money.of(grossSalary);
        employee.payeRate = Money.of(payeRate);
        employee.pensionRate = Money.of(pensionRate);
        employee.otherDeductions = Money.of(otherDeductions);
        employee.otherAllowances = Money.of(otherAllowances);
        employee.active = true;
        return employee;
    }

    public void deactivate() {
        this.active = false;
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
    }
}
