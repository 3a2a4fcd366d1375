package com.flagship.erp_ledger.sales;

import com.flagship.erp_ledger.common.DocumentTotals;
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
import java.util.UUID;

@Entity
@Table(name = "credit_note_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CreditNoteItem {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "credit_note_id", nullable = false, updatable = false)
    private CreditNote creditNote;

    @Column(name = "invoice_item_id", nullable = false, updatable = false)
    private UUID invoiceItemId;

    @Column(name = "product_id", nullable = false, updatable = false)
    private UUID productId;

    @Column(name = "quantity", nullable = false, precision = 15, scale = 2)
    private BigDecimal quantity;

    @Column(name = "price", nullable = false, precision = 15, scale = 2)
    private BigDecimal price;

    @Column(name = "amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "line_number", nullable = false)
    private int lineNumber;

    CreditNoteItem(CreditNote creditNote, int lineNumber, SalesInvoiceItem invoiceItem, BigDecimal quantity) {
        this.creditNote = creditNote;
        this.lineNumber = lineNumber;
        this.invoiceItemId = invoiceItem.getId();
        this.productId = invoiceItem.getProductId();
        this.quantity = quantity;
        this.price = invoiceItem.getPrice();
        this.amount = DocumentTotals.lineAmount(quantity, invoiceItem.getPrice());
    }
}
