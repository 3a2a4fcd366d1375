package com.flagship.erp_ledger.common;

import com.flagship.erp_ledger.common.exception.ValidationException;
import jakarta.persistence.Column;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Common state of documents that are settled by payments: sales invoices and purchase bills.
 *
 * Status transitions happen only through {@link #applyPayment(BigDecimal)} and {@link #writeOff()}.
 */
@MappedSuperclass
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class SettleableDocument {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "business_id", nullable = false, updatable = false)
    private UUID businessId;

    @Column(name = "branch_id", nullable = false, updatable = false)
    private UUID branchId;

    @Column(name = "due_date")
    private LocalDate dueDate;

    @Column(name = "notes")
    private String notes;

    @Column(name = "vat_rate", nullable = false, precision = 5, scale = 2)
    private BigDecimal vatRate;

    @Column(name = "sub_total", nullable = false, precision = 15, scale = 2)
    private BigDecimal subTotal;

    @Column(name = "vat_amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal vatAmount;

    @Column(name = "total_amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "paid_amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal paidAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SettlementStatus status;

    @Column(name = "created_by", updatable = false)
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected SettleableDocument(TenantScope scope, LocalDate dueDate, String notes, BigDecimal vatRate) {
        this.businessId = scope.getBusinessId();
        this.branchId = scope.requireBranch();
        this.createdBy = scope.getUserId();
        this.dueDate = dueDate;
        this.notes = notes;
        this.vatRate = Money.orZero(vatRate);
        this.subTotal = Money.ZERO;
        this.vatAmount = Money.ZERO;
        this.totalAmount = Money.ZERO;
        this.paidAmount = Money.ZERO;
        this.status = SettlementStatus.UNPAID;
    }

    /**
     * Human readable reference used in ledger descriptions, e.g. "Invoice INV-00001".
     */
    public abstract String getDocumentLabel();

    public abstract String getNumber();

    protected void applyTotals(DocumentTotals totals) {
        this.subTotal = totals.getSubTotal();
        this.vatAmount = totals.getVatAmount();
        this.totalAmount = totals.getTotalAmount();
    }

    public BigDecimal getOutstanding() {
        return totalAmount.subtract(paidAmount);
    }

    /**
     * Adds a payment. Overpayment is accepted and leaves the document PAID.
     */
    public void applyPayment(BigDecimal amount) {
        if (!Money.isPositive(amount)) {
            throw new ValidationException("Payment amount must be greater than zero");
        }
        if (status == SettlementStatus.WRITTEN_OFF) {
            throw new ValidationException(getDocumentLabel() + " has been written off and cannot take payments");
        }
        this.paidAmount = Money.of(paidAmount.add(amount));
        this.status = SettlementStatus.afterPayment(status, paidAmount, totalAmount);
    }

    /**
     * Marks the remaining balance as bad debt.
     *
     * @return the amount written off
     */
    public BigDecimal writeOff() {
        if (status == SettlementStatus.WRITTEN_OFF) {
            throw new ValidationException(getDocumentLabel() + " is already written off");
        }
        BigDecimal remaining = getOutstanding();
        if (remaining.signum() <= 0) {
            throw new ValidationException(getDocumentLabel() + " is already paid in full");
        }
        this.status = SettlementStatus.WRITTEN_OFF;
        return remaining;
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
