package com.flagship.erp_ledger.budget;

import com.flagship.erp_ledger.budget.dto.BudgetResponse;
import com.flagship.erp_ledger.budget.dto.CreateBudgetRequest;
import com.flagship.erp_ledger.common.TenantScope;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/budgets")
@RequiredArgsConstructor
public class BudgetController {

    private final BudgetService budgetService;

    @PostMapping
    public ResponseEntity<BudgetResponse> create(TenantScope scope, @Valid @RequestBody CreateBudgetRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(BudgetResponse.from(budgetService.create(scope, request)));
    }

    @GetMapping
    public List<BudgetResponse> list(TenantScope scope) {
        return budgetService.list(scope).stream().map(BudgetResponse::from).toList();
    }

    @GetMapping("/{id}")
    public BudgetResponse get(TenantScope scope, @PathVariable("id") UUID id) {
        return BudgetResponse.from(budgetService.get(scope, id));
    }

    @GetMapping("/{id}/vs-actual")
    public BudgetComparison budgetVsActual(TenantScope scope, @PathVariable("id") UUID id) {
        return budgetService.budgetVsActual(scope, id);
    }
}
