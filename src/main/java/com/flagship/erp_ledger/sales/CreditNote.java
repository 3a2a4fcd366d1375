package com.flagship.erp_ledger.sales;

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
 * Goods returned by a customer against an invoice. The invoice itself is left unchanged.
 */
@Entity
@Table(name = "credit_notes")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CreditNote {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "business_id", nullable = false, updatable = false)
    private UUID businessId;

    @Column(name = "branch_id", nullable = false, updatable = false)
    private UUID branchId;

    @Column(name = "credit_note_number", nullable = false, updatable = false, length = 50)
    private String creditNoteNumber;

    @Column(name = "invoice_id", nullable = false, updatable = false)
    private UUID invoiceId;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

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

    @OneToMany(mappedBy = "creditNote", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNumber")
    private List<CreditNoteItem> items = new ArrayList<>();

    public static CreditNote create(TenantScope scope, String number, SalesInvoice invoice, LocalDate noteDate,
                                    String reason) {
        CreditNote note = new CreditNote();
        note.businessId = scope.getBusinessId();
        note.branchId = invoice.getBranchId();
        note.createdBy = scope.getUserId();
        note.creditNoteNumber = number;
        note.invoiceId = invoice.getId();
        note.customerId = invoice.getCustomerId();
        note.noteDate = noteDate;
        note.reason = reason != null ? reason : "Invoice Return";
        note.totalAmount = Money.ZERO;
        return note;
    }

    /**
     * Returns {@code quantity} of an invoice line at its original price.
     */
    public CreditNoteItem addReturn(SalesInvoiceItem invoiceItem, BigDecimal quantity) {
        CreditNoteItem item = new CreditNoteItem(this, items.size() + 1, invoiceItem, quantity);
        items.add(item);
        this.totalAmount = Money.of(totalAmount.add(item.getAmount()));
        return item;
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now();
    }
}
