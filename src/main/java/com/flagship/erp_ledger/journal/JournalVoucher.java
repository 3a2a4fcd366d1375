package com.flagship.erp_ledger.journal;

import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.ValidationException;
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
 * Manual journal entry header. Its lines live in the ledger under document type JOURNAL_VOUCHER.
 */
@Entity
@Table(name = "journal_vouchers")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class JournalVoucher {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "business_id", nullable = false, updatable = false)
    private UUID businessId;

    @Column(name = "branch_id", nullable = false, updatable = false)
    private UUID branchId;

    @Column(name = "voucher_number", nullable = false, updatable = false, length = 50)
    private String voucherNumber;

    @Column(name = "voucher_date", nullable = false)
    private LocalDate voucherDate;

    @Column(name = "description")
    private String description;

    @Column(name = "reference", length = 100)
    private String reference;

    @Column(name = "total_amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "is_posted", nullable = false)
    private boolean posted;

    @Column(name = "posted_at")
    private Instant postedAt;

    @Column(name = "created_by", updatable = false)
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static JournalVoucher create(TenantScope scope, String voucherNumber, LocalDate voucherDate,
                                        String description, String reference, BigDecimal totalAmount) {
        JournalVoucher voucher = new JournalVoucher();
        voucher.businessId = scope.getBusinessId();
        voucher.branchId = scope.requireBranch();
        voucher.createdBy = scope.getUserId();
        voucher.voucherNumber = voucherNumber;
        voucher.voucherDate = voucherDate;
        voucher.description = description;
        voucher.reference = reference;
        voucher.totalAmount = totalAmount;
        voucher.posted = false;
        return voucher;
    }

    public void markPosted() {
        if (posted) {
            throw new ValidationException("Journal voucher " + voucherNumber + " is already posted");
        }
        this.posted = true;
        this.postedAt = Instant.now();
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
