package com.flagship.erp_ledger.budget;

import com.flagship.erp_ledger.common.Money;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "budget_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BudgetItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "budget_id", nullable = false, updatable = false)
    private Budget budget;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Column(name = "amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "month")
    private Integer month;

    BudgetItem(Budget budget, UUID accountId, BigDecimal amount, Integer month) {
        this.budget = budget;
        this.accountId = accountId;
        this.amount = Money.of(amount);
        this.month = month;
    }

    public LocalDate periodStart(int fiscalYear) {
        return month != null ? LocalDate.of(fiscalYear, month, 1) : LocalDate.of(fiscalYear, 1, 1);
    }

    public LocalDate periodEnd(int fiscalYear) {
        LocalDate start = periodStart(fiscalYear);
        return month != null ? start.withDayOfMonth(start.lengthOfMonth()) : LocalDate.of(fiscalYear, 12, 31);
    }
}
