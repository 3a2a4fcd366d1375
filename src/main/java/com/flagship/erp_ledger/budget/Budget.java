package com.flagship.erp_ledger.budget;

import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.ValidationException;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Planned amounts per account for one fiscal year.
 */
@Entity
@Table(name = "budgets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Budget {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "business_id", nullable = false, updatable = false)
    private UUID businessId;

    @Column(name = "branch_id", updatable = false)
    private UUID branchId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "fiscal_year", nullable = false)
    private int fiscalYear;

    @Column(name = "description")
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @OneToMany(mappedBy = "budget", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<BudgetItem> items = new ArrayList<>();

    public static Budget create(TenantScope scope, String name, int fiscalYear, String description) {
        Budget budget = new Budget();
        budget.businessId = scope.getBusinessId();
        budget.branchId = scope.getBranchId();
        budget.name = name;
        budget.fiscalYear = fiscalYear;
        budget.description = description;
        return budget;
    }

    /**
     * @param month 1-12 for a monthly line, null for the whole year
     */
    public BudgetItem addItem(UUID accountId, BigDecimal amount, Integer month) {
        if (amount == null || amount.signum() < 0) {
            throw new ValidationException("Budgeted amount must not be negative");
        }
        if (month != null && (month < 1 || month > 12)) {
            throw new ValidationException("Budget month must be between 1 and 12, got " + month);
        }
        BudgetItem item = new BudgetItem(this, accountId, amount, month);
        items.add(item);
        return item;
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
    }
}
