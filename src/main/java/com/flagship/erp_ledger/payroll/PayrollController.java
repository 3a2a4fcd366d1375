package com.flagship.erp_ledger.payroll;

import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.idempotency.IdempotencyService;
import com.flagship.erp_ledger.idempotency.IdempotentOperation;
import com.flagship.erp_ledger.idempotency.IdempotentResult;
import com.flagship.erp_ledger.observability.CorrelationContext;
import com.flagship.erp_ledger.payroll.dto.CreateEmployeeRequest;
import com.flagship.erp_ledger.payroll.dto.CreatePayslipRequest;
import com.flagship.erp_ledger.payroll.dto.EmployeeResponse;
import com.flagship.erp_ledger.payroll.dto.PayrollPeriodRequest;
import com.flagship.erp_ledger.payroll.dto.PayslipPaymentRequest;
import com.flagship.erp_ledger.payroll.dto.PayslipResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/payroll")
@RequiredArgsConstructor
public class PayrollController {

    private final PayrollService payrollService;
    private final IdempotencyService idempotencyService;

    @PostMapping("/employees")
    public ResponseEntity<EmployeeResponse> createEmployee(TenantScope scope,
                                                           @Valid @RequestBody CreateEmployeeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(EmployeeResponse.from(payrollService.createEmployee(scope, request)));
    }

    @GetMapping("/employees")
    public List<EmployeeResponse> listEmployees(TenantScope scope) {
        return payrollService.listEmployees(scope).stream().map(EmployeeResponse::from).toList();
    }

    @GetMapping("/employees/{id}")
    public EmployeeResponse getEmployee(TenantScope scope, @PathVariable("id") UUID id) {
        return EmployeeResponse.from(payrollService.getEmployee(scope, id));
    }

    @DeleteMapping("/employees/{id}")
    public EmployeeResponse deactivateEmployee(TenantScope scope, @PathVariable("id") UUID id) {
        return EmployeeResponse.from(payrollService.deactivateEmployee(scope, id));
    }

    @PostMapping("/payslips")
    public ResponseEntity<PayslipResponse> createPayslip(TenantScope scope,
                                                         @Valid @RequestBody CreatePayslipRequest request) {
        Payslip payslip = payrollService.createPayslip(scope, request.getEmployeeId(), request.getPeriodStart(),
            request.getPeriodEnd(), request.getExtraDeductions(), request.getExtraAllowances());
        return ResponseEntity.status(HttpStatus.CREATED).body(PayslipResponse.from(payslip));
    }

    @PostMapping("/runs")
    public ResponseEntity<List<PayslipResponse>> runPayroll(TenantScope scope,
                                                            @Valid @RequestBody PayrollPeriodRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(
            payrollService.runPayroll(scope, request.getPeriodStart(), request.getPeriodEnd()).stream()
                .map(PayslipResponse::from)
                .toList());
    }

    @GetMapping("/payslips")
    public List<PayslipResponse> listPayslips(TenantScope scope,
                                              @RequestParam(name = "employee_id", required = false) UUID employeeId) {
        return payrollService.listPayslips(scope, employeeId).stream().map(PayslipResponse::from).toList();
    }

    @GetMapping("/payslips/{id}")
    public PayslipResponse getPayslip(TenantScope scope, @PathVariable("id") UUID id) {
        return PayslipResponse.from(payrollService.getPayslip(scope, id));
    }

    @PostMapping("/payslips/{id}/payment")
    public ResponseEntity<PayslipResponse> markPaid(TenantScope scope, @PathVariable("id") UUID id,
                                                    @RequestHeader(IdempotencyService.IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
                                                    @Valid @RequestBody PayslipPaymentRequest request) {
        IdempotentResult result = idempotencyService.execute(scope, idempotencyKey, IdempotentOperation.PAYSLIP_PAYMENT,
            () -> payrollService.markPaid(scope, id, request.getPaymentAccountId(), request.getPaidDate()).getId());
        CorrelationContext.setDocumentId(result.getResourceId());
        return ResponseEntity.status(result.responseStatus())
            .body(PayslipResponse.from(payrollService.getPayslip(scope, result.getResourceId())));
    }

    @GetMapping("/summary")
    public PayrollSummary summary(TenantScope scope,
                                  @RequestParam("period_start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate periodStart,
                                  @RequestParam("period_end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate periodEnd) {
        return payrollService.summary(scope, periodStart, periodEnd);
    }
}
