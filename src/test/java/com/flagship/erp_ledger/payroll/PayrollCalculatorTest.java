package com.flagship.erp_ledger.payroll;

import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PayrollCalculatorTest {

    private final PayrollCalculator calculator = new PayrollCalculator();
    private final TenantScope scope = TenantScope.of(UUID.randomUUID(), UUID.randomUUID());

    private Employee employee(String salary, String paye, String pension, String deductions, String allowances) {
        return Employee.create(scope, "Ada Obi", "E-001", "Clerk", new BigDecimal(salary), new BigDecimal(paye),
            new BigDecimal(pension), new BigDecimal(deductions), new BigDecimal(allowances));
    }

    @Test
    @DisplayName("PAYE and pension are taken from base salary; allowances only raise gross")
    void standardPayslip() {
        Employee employee = employee("100000.00", "10", "8", "2000.00", "15000.00");

        PayrollBreakdown breakdown = calculator.calculate(employee, new BigDecimal("500.00"), new BigDecimal("1000.00"));

        assertEquals(new BigDecimal("100000.00"), breakdown.getBasicSalary());
        assertEquals(new BigDecimal("16000.00"), breakdown.getAllowances());
        assertEquals(new BigDecimal("116000.00"), breakdown.getGrossPay());
        assertEquals(new BigDecimal("10000.00"), breakdown.getPayeDeduction());
        assertEquals(new BigDecimal("8000.00"), breakdown.getPensionDeduction());
        assertEquals(new BigDecimal("2500.00"), breakdown.getOtherDeductions());
        assertEquals(new BigDecimal("20500.00"), breakdown.getTotalDeductions());
        assertEquals(new BigDecimal("95500.00"), breakdown.getNetPay());
    }

    @Test
    @DisplayName("Missing extras count as zero")
    void noExtras() {
        PayrollBreakdown breakdown = calculator.calculate(employee("5000.00", "0", "0", "0", "0"), null, null);

        assertEquals(new BigDecimal("5000.00"), breakdown.getGrossPay());
        assertEquals(new BigDecimal("0.00"), breakdown.getTotalDeductions());
        assertEquals(new BigDecimal("5000.00"), breakdown.getNetPay());
    }

    @Test
    @DisplayName("Deductions larger than gross pay are refused")
    void negativeNetPay() {
        Employee employee = employee("1000.00", "50", "10", "300.00", "0");

        assertThrows(ValidationException.class,
            () -> calculator.calculate(employee, new BigDecimal("200.00"), BigDecimal.ZERO));
    }
}
