package com.flagship.erp_ledger.payroll;

import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.NotFoundException;
import com.flagship.erp_ledger.common.exception.ValidationException;
import com.flagship.erp_ledger.ledger.AccountService;
import com.flagship.erp_ledger.ledger.LedgerService;
import com.flagship.erp_ledger.payroll.dto.CreateEmployeeRequest;
import com.flagship.erp_ledger.posting.DocumentNumberService;
import com.flagship.erp_ledger.posting.DocumentRef;
import com.flagship.erp_ledger.posting.PostingAccounts;
import com.flagship.erp_ledger.posting.PostingConfigurationService;
import com.flagship.erp_ledger.posting.PostingRules;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.flagship.erp_ledger.posting.WellKnownAccount.PAYROLL_LIABILITIES;
import static com.flagship.erp_ledger.posting.WellKnownAccount.SALARIES_EXPENSE;

/**
 * Employees, payslip generation and salary payments. Payslips touch the ledger only when they are paid.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayrollService {

    private final EmployeeRepository employeeRepository;
    private final PayslipRepository payslipRepository;
    private final PayrollCalculator calculator;
    private final DocumentNumberService documentNumberService;
    private final PostingConfigurationService postingConfiguration;
    private final PostingRules postingRules;
    private final LedgerService ledgerService;
    private final AccountService accountService;

    @Transactional
    public Employee createEmployee(TenantScope scope, CreateEmployeeRequest request) {
        Employee employee = employeeRepository.save(Employee.create(scope, request.getFullName(),
            request.getEmployeeCode(), request.getPosition(), request.getGrossSalary(), request.getPayeRate(),
            request.getPensionRate(), request.getOtherDeductions(), request.getOtherAllowances()));
        log.info("Employee created: name={}, branch={}", employee.getFullName(), employee.getBranchId());
        return employee;
    }

    @Transactional(readOnly = true)
    public Employee getEmployee(TenantScope scope, UUID employeeId) {
        return employeeRepository.findByIdAndBusinessId(employeeId, scope.getBusinessId())
            .orElseThrow(() -> NotFoundException.of("Employee", employeeId));
    }

    @Transactional(readOnly = true)
    public List<Employee> listEmployees(TenantScope scope) {
        return scope.getBranchId() != null
            ? employeeRepository.findByBusinessIdAndBranchIdOrderByFullNameAsc(scope.getBusinessId(), scope.getBranchId())
            : employeeRepository.findByBusinessIdOrderByFullNameAsc(scope.getBusinessId());
    }

    @Transactional
    public Employee deactivateEmployee(TenantScope scope, UUID employeeId) {
        Employee employee = getEmployee(scope, employeeId);
        employee.deactivate();
        log.info("Employee deactivated: {}", employee.getFullName());
        return employee;
    }

    @Transactional
    public Payslip createPayslip(TenantScope scope, UUID employeeId, LocalDate periodStart, LocalDate periodEnd,
                                 BigDecimal extraDeductions, BigDecimal extraAllowances) {
        requirePeriod(periodStart, periodEnd);
        Employee employee = getEmployee(scope, employeeId);
        if (!employee.isActive()) {
            throw new ValidationException("Employee " + employee.getFullName() + " is inactive");
        }
        if (payslipRepository.existsByEmployeeIdAndPeriodStartAndPeriodEnd(employeeId, periodStart, periodEnd)) {
            throw new ValidationException("A payslip for " + employee.getFullName() + " already exists for "
                + periodStart + " to " + periodEnd);
        }
        return issue(employee, periodStart, periodEnd, extraDeductions, extraAllowances);
    }

    /**
     * Issues payslips for every active employee of the current branch. Employees already holding a payslip
     * for the period are skipped.
     */
    @Transactional
    public List<Payslip> runPayroll(TenantScope scope, LocalDate periodStart, LocalDate periodEnd) {
        requirePeriod(periodStart, periodEnd);
        UUID branchId = scope.requireBranch();

        List<Payslip> issued = new ArrayList<>();
        for (Employee employee : employeeRepository.findByBusinessIdAndBranchIdAndActiveTrueOrderByFullNameAsc(
                scope.getBusinessId(), branchId)) {
            if (payslipRepository.existsByEmployeeIdAndPeriodStartAndPeriodEnd(employee.getId(), periodStart, periodEnd)) {
                log.debug("Skipping {}: payslip already issued for {} to {}", employee.getFullName(), periodStart, periodEnd);
                continue;
            }
            issued.add(issue(employee, periodStart, periodEnd, Money.ZERO, Money.ZERO));
        }
        log.info("Payroll run: branch={}, period={} to {}, payslips={}", branchId, periodStart, periodEnd, issued.size());
        return issued;
    }

    /**
     * Pays a payslip: Dr Salaries Expense (gross), Cr payment account (net), Cr Payroll Liabilities (deductions).
     */
    @Transactional
    public Payslip markPaid(TenantScope scope, UUID payslipId, UUID paymentAccountId, LocalDate paidDate) {
        Payslip payslip = payslipRepository.findForUpdate(payslipId, scope.getBusinessId())
            .orElseThrow(() -> NotFoundException.of("Payslip", payslipId));
        PostingAccounts accounts = postingConfiguration.forTenant(scope.getBusinessId());
        accounts.require(SALARIES_EXPENSE);
        if (Money.isPositive(payslip.getTotalDeductions())) {
            accounts.require(PAYROLL_LIABILITIES);
        }
        accountService.requirePaymentAccount(scope, paymentAccountId);

        LocalDate date = paidDate != null ? paidDate : LocalDate.now();
        payslip.markPaid(paymentAccountId, date);

        DocumentRef ref = DocumentRef.builder()
            .businessId(payslip.getBusinessId())
            .branchId(payslip.getBranchId())
            .documentType(DocumentType.PAYSLIP)
            .documentId(payslip.getId())
            .documentNumber(payslip.getPayslipNumber())
            .transactionDate(date)
            .build();
        ledgerService.post(postingRules.payslipPayment(ref, payslip.getGrossPay(), payslip.getNetPay(),
            payslip.getTotalDeductions(), paymentAccountId, accounts));

        log.info("Payslip paid: number={}, net={}", payslip.getPayslipNumber(), payslip.getNetPay());
        return payslip;
    }

    @Transactional(readOnly = true)
    public Payslip getPayslip(TenantScope scope, UUID payslipId) {
        return payslipRepository.findByIdAndBusinessId(payslipId, scope.getBusinessId())
            .orElseThrow(() -> NotFoundException.of("Payslip", payslipId));
    }

    @Transactional(readOnly = true)
    public List<Payslip> listPayslips(TenantScope scope, UUID employeeId) {
        return employeeId != null
            ? payslipRepository.findByBusinessIdAndEmployeeIdOrderByPeriodStartDesc(scope.getBusinessId(), employeeId)
            : payslipRepository.findByBusinessIdOrderByPeriodStartDescPayslipNumberDesc(scope.getBusinessId());
    }

    @Transactional(readOnly = true)
    public PayrollSummary summary(TenantScope scope, LocalDate periodStart, LocalDate periodEnd) {
        requirePeriod(periodStart, periodEnd);
        return PayrollSummary.of(periodStart, periodEnd,
            payslipRepository.findWithinPeriod(scope.getBusinessId(), periodStart, periodEnd));
    }

    private Payslip issue(Employee employee, LocalDate periodStart, LocalDate periodEnd,
                          BigDecimal extraDeductions, BigDecimal extraAllowances) {
        PayrollBreakdown breakdown = calculator.calculate(employee, extraDeductions, extraAllowances);
        String number = documentNumberService.next(employee.getBusinessId(), DocumentType.PAYSLIP);
        Payslip payslip = payslipRepository.save(Payslip.create(number, employee, periodStart, periodEnd, breakdown));
        log.info("Payslip issued: number={}, employee={}, gross={}, net={}", number, employee.getFullName(),
                breakdown.getGrossPay(), breakdown.getNetPay());
        return payslip;
    }

    private static void requirePeriod(LocalDate periodStart, LocalDate periodEnd) {
        if (periodStart == null || periodEnd == null) {
            throw new ValidationException("Pay period start and end are required");
        }
        if (periodEnd.isBefore(periodStart)) {
            throw new ValidationException("Pay period end " + periodEnd + " is before its start " + periodStart);
        }
    }
}
