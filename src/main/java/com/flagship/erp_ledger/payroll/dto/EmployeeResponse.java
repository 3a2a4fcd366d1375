package com.flagship.erp_ledger.payroll.dto;

import com.flagship.erp_ledger.payroll.Employee;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class EmployeeResponse {
    UUID id;
    UUID branchId;
    String fullName;
    String employeeCode;
    String position;
    BigDecimal grossSalary;
    BigDecimal payeRate;
    BigDecimal pensionRate;
    BigDecimal otherDeductions;
    BigDecimal otherAllowances;
    boolean active;

    public static EmployeeResponse from(Employee employee) {
        return EmployeeResponse.builder()
            .id(employee.getId())
            .branchId(employee.getBranchId())
            .fullName(employee.getFullName())
            .employeeCode(employee.getEmployeeCode())
            .position(employee.getPosition())
            .grossSalary(employee.getGrossSalary())
            .payeRate(employee.getPayeRate())
            .pensionRate(employee.getPensionRate())
            .otherDeductions(employee.getOtherDeductions())
            .otherAllowances(employee.getOtherAllowances())
            .active(employee.isActive())
            .build();
    }
}
