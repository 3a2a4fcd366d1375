package com.flagship.erp_ledger.report;

import com.flagship.erp_ledger.common.TenantScope;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.UUID;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
public class ReportController {

    private final ReportService reportService;

    @GetMapping("/trial-balance")
    public TrialBalance trialBalance(TenantScope scope,
                                     @RequestParam(name = "as_of", required = false)
                                     @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return reportService.trialBalance(scope, asOf);
    }

    @GetMapping("/balance-sheet")
    public BalanceSheet balanceSheet(TenantScope scope,
                                     @RequestParam(name = "as_of", required = false)
                                     @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return reportService.balanceSheet(scope, asOf);
    }

    @GetMapping("/income-statement")
    public IncomeStatement incomeStatement(TenantScope scope,
                                           @RequestParam("start_date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
                                           @RequestParam("end_date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return reportService.incomeStatement(scope, startDate, endDate);
    }

    @GetMapping("/general-ledger")
    public GeneralLedger generalLedger(TenantScope scope,
                                       @RequestParam(name = "account_id", required = false) UUID accountId,
                                       @RequestParam(name = "start_date", required = false)
                                       @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
                                       @RequestParam(name = "end_date", required = false)
                                       @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {
        return reportService.generalLedger(scope, accountId, startDate, endDate);
    }

    @GetMapping("/aging/receivables")
    public AgingReport receivablesAging(TenantScope scope,
                                        @RequestParam(name = "as_of", required = false)
                                        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return reportService.receivablesAging(scope, asOf);
    }

    @GetMapping("/aging/payables")
    public AgingReport payablesAging(TenantScope scope,
                                     @RequestParam(name = "as_of", required = false)
                                     @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf) {
        return reportService.payablesAging(scope, asOf);
    }

    @GetMapping("/customers/{customerId}/balance")
    public CounterpartyBalance customerBalance(TenantScope scope, @PathVariable("customerId") UUID customerId) {
        return reportService.customerBalance(scope, customerId);
    }

    @GetMapping("/vendors/{vendorId}/balance")
    public CounterpartyBalance vendorBalance(TenantScope scope, @PathVariable("vendorId") UUID vendorId) {
        return reportService.vendorBalance(scope, vendorId);
    }
}
