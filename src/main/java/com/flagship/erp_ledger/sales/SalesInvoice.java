package com.flagship.erp_ledger.sales;

import com.flagship.erp_ledger.common.DocumentTotals;
import com.flagship.erp_ledger.common.SettleableDocument;
import com.flagship.erp_ledger.common.TenantScope;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "sales_invoices")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SalesInvoice extends SettleableDocument {

    @Column(name = "invoice_number", nullable = false, updatable = false, length = 50)
    private String invoiceNumber;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

    @Column(name = "invoice_date", nullable = false)
    private LocalDate invoiceDate;

    @OneToMany(mappedBy = "invoice", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNumber")
    private List<SalesInvoiceItem> items = new ArrayList<>();

    private SalesInvoice(TenantScope scope, String invoiceNumber, UUID customerId, LocalDate invoiceDate,
                         LocalDate dueDate, String notes, BigDecimal vatRate) {
        super(scope, dueDate, notes, vatRate);
        this.invoiceNumber = invoiceNumber;
        this.customerId = customerId;
        this.invoiceDate = invoiceDate;
    }

    public static SalesInvoice create(TenantScope scope, String invoiceNumber, UUID customerId, LocalDate invoiceDate,
                                      LocalDate dueDate, String notes, BigDecimal vatRate) {
        return new SalesInvoice(scope, invoiceNumber, customerId, invoiceDate, dueDate, notes, vatRate);
    }

    public SalesInvoiceItem addItem(UUID productId, String description, BigDecimal quantity, BigDecimal price) {
        SalesInvoiceItem item = new SalesInvoiceItem(this, items.size() + 1, productId, description, quantity, price);
        items.add(item);
        return item;
    }

    /**
     * Recomputes sub-total, VAT and total from the current items.
     */
    public DocumentTotals recalculate() {
        DocumentTotals totals = DocumentTotals.calculate(
            items.stream().map(SalesInvoiceItem::getAmount).toList(), getVatRate());
        applyTotals(totals);
        return totals;
    }

    public SalesInvoiceItem findItem(UUID itemId) {
        return items.stream()
            .filter(item -> item.getId().equals(itemId))
            .findFirst()
            .orElse(null);
    }

    @Override
    public String getDocumentLabel() {
        return "Invoice " + invoiceNumber;
    }

    @Override
    public String getNumber() {
        return invoiceNumber;
    }
}
