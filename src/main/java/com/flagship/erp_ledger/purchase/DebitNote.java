package com.flagship.erp_ledger.purchase;

import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.common.TenantScope;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Goods sent back to a vendor against a bill.
 */
@Entity
@Table(name = "debit_notes")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DebitNote {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "business_id", nullable = false, updatable = false)
    private UUID businessId;

    @Column(name = "branch_id", nullable = false, updatable = false)
    private UUID branchId;

    @Column(name = "debit_note_number", nullable = false, updatable = false, length = 50)
    private String debitNoteNumber;

    @Column(name = "bill_id", nullable = false, updatable = false)
    private UUID billId;

    @Column(name = "vendor_id", nullable = false, updatable = false)
    private UUID vendorId;

    @Column(name = "note_date", nullable = false)
    private LocalDate noteDate;

    @Column(name = "reason")
    private String reason;

    @Column(name = "total_amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "created_by", updatable = false)
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @OneToMany(mappedBy = "debitNote", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNumber")
    private List<DebitNoteItem> items = new ArrayList<>();

    public static DebitNote create(TenantScope scope, String number, PurchaseBill bill, LocalDate noteDate,
                                   String reason) {
        DebitNote note = new DebitNote();
        note.businessId = scope.getBusinessId();
        note.branchId = bill.getBranchId();
        note.createdBy = scope.getUserId();
        note.debitNoteNumber = number;
        note.billId = bill.getId();
        note.vendorId = bill.getVendorId();
        note.noteDate = noteDate;
        note.reason = reason != null ? reason : "Purchase Return";
        note.totalAmount = Money.ZERO;
        return note;
    }

    public DebitNoteItem addReturn(PurchaseBillItem billItem, BigDecimal quantity) {
        DebitNoteItem item = new DebitNoteItem(this, items.size() + 1, billItem, quantity);
        items.add(item);
        this.totalAmount = Money.of(totalAmount.add(item.getAmount()));
        return item;
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
    }
}
