package com.flagship.erp_ledger.payroll;

import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.common.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Payslip arithmetic.
 *
 * <ul>
 *   <li>gross = base salary + configured allowances + extra allowances</li>
 *   <li>PAYE and pension are percentages of the base salary</li>
 *   <li>total deductions = PAYE + pension + configured deductions + extra deductions</li>
 *   <li>net = gross - total deductions, never negative</li>
 * </ul>
 */
@Component
public class PayrollCalculator {

    public PayrollBreakdown calculate(Employee employee, BigDecimal extraDeductions, BigDecimal extraAllowances) {
        BigDecimal extraDeduction = Money.of(extraDeductions);
        BigDecimal extraAllowance = Money.of(extraAllowances);
        if (extraDeduction.signum() < 0 || extraAllowance.signum() < 0) {
            throw new ValidationException("Extra deductions and allowances must not be negative");
        }

        BigDecimal basic = Money.of(employee.getGrossSalary());
        BigDecimal allowances = Money.of(employee.getOtherAllowances().add(extraAllowance));
        BigDecimal gross = basic.add(allowances);

        BigDecimal paye = Money.percentOf(basic, employee.getPayeRate());
        BigDecimal pension = Money.percentOf(basic, employee.getPensionRate());
        BigDecimal other = Money.of(employee.getOtherDeductions().add(extraDeduction));
        BigDecimal totalDeductions = paye.add(pension).add(other);
        BigDecimal net = gross.subtract(totalDeductions);

        if (net.signum() < 0) {
            throw new ValidationException("Deductions of " + totalDeductions + " exceed gross pay of " + gross
                + " for " + employee.getFullName());
        }

        return PayrollBreakdown.builder()
            .basicSalary(basic)
            .allowances(allowances)
            .grossPay(gross)
            .payeDeduction(paye)
            .pensionDeduction(pension)
            .otherDeductions(other)
            .totalDeductions(totalDeductions)
            .netPay(net)
            .build();
    }
}
