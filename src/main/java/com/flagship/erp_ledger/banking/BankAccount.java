package com.flagship.erp_ledger.banking;

import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.common.TenantScope;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A real-world bank account backed by one ASSET account of the chart.
 *
 * {@code currentBalance} is a cached copy of the linked chart account's raw ledger balance; it only changes
 * through {@link #applyLedgerMovement(BigDecimal)} as entries are posted.
 */
@Entity
@Table(name = "bank_accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BankAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "business_id", nullable = false, updatable = false)
    private UUID businessId;

    @Column(name = "branch_id")
    private UUID branchId;

    @Column(name = "account_name", nullable = false, length = 100)
    private String accountName;

    @Column(name = "bank_name", length = 100)
    private String bankName;

    @Column(name = "account_number", length = 50)
    private String accountNumber;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "chart_account_id", nullable = false, updatable = false)
    private UUID chartAccountId;

    @Column(name = "current_balance", nullable = false, precision = 15, scale = 2)
    private BigDecimal currentBalance;

    @Column(name = "last_reconciled_date")
    private LocalDate lastReconciledDate;

    @Column(name = "last_reconciled_balance", precision = 15, scale = 2)
    private BigDecimal lastReconciledBalance;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static BankAccount create(TenantScope scope, String accountName, String bankName, String accountNumber,
                                     String currency, UUID chartAccountId, BigDecimal ledgerBalance) {
        BankAccount account = new BankAccount();
        account.businessId = scope.getBusinessId();
        account.branchId = scope.getBranchId();
        account.accountName = accountName;
        account.bankName = bankName;
        account.accountNumber = accountNumber;
        account.currency = currency != null ? currency.toUpperCase() : "NGN";
        account.chartAccountId = chartAccountId;
        account.currentBalance = Money.of(ledgerBalance);
        account.active = true;
        return account;
    }

    /**
     * Applies the net (debit minus credit) of entries just posted to the linked chart account.
     */
    public void applyLedgerMovement(BigDecimal net) {
        this.currentBalance = Money.of(currentBalance.add(net));
    }

    public boolean canCover(BigDecimal amount) {
        return currentBalance.compareTo(amount) >= 0;
    }

    /**
     * @return book balance minus statement balance
     */
    public BigDecimal reconcile(BigDecimal statementBalance, LocalDate date) {
        this.lastReconciledDate = date;
        this.lastReconciledBalance = Money.of(statementBalance);
        return currentBalance.subtract(lastReconciledBalance);
    }

    public void deactivate() {
        this.active = false;
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
