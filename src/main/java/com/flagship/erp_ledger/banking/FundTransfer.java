package com.flagship.erp_ledger.banking;

import com.flagship.erp_ledger.common.TenantScope;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "fund_transfers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FundTransfer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "business_id", nullable = false, updatable = false)
    private UUID businessId;

    @Column(name = "branch_id", nullable = false, updatable = false)
    private UUID branchId;

    @Column(name = "transfer_number", nullable = false, updatable = false, length = 50)
    private String transferNumber;

    @Column(name = "from_account_id", nullable = false, updatable = false)
    private UUID fromAccountId;

    @Column(name = "to_account_id", nullable = false, updatable = false)
    private UUID toAccountId;

    @Column(name = "amount", nullable = false, updatable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "transfer_date", nullable = false, updatable = false)
    private LocalDate transferDate;

    @Column(name = "description")
    private String description;

    @Column(name = "reference", length = 100)
    private String reference;

    @Column(name = "created_by", updatable = false)
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static FundTransfer create(TenantScope scope, String number, BankAccount from, BankAccount to,
                                      BigDecimal amount, LocalDate transferDate, String description, String reference) {
        FundTransfer transfer = new FundTransfer();
        transfer.businessId = scope.getBusinessId();
        transfer.branchId = scope.requireBranch();
        transfer.createdBy = scope.getUserId();
        transfer.transferNumber = number;
        transfer.fromAccountId = from.getId();
        transfer.toAccountId = to.getId();
        transfer.amount = amount;
        transfer.transferDate = transferDate;
        transfer.description = description;
        transfer.reference = reference;
        return transfer;
    }

    public boolean involves(UUID bankAccountId) {
        return fromAccountId.equals(bankAccountId) || toAccountId.equals(bankAccountId);
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
    }
}
