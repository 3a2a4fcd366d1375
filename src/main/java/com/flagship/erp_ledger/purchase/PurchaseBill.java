package com.flagship.erp_ledger.purchase;

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
@Table(name = "purchase_bills")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PurchaseBill extends SettleableDocument {

    @Column(name = "bill_number", nullable = false, updatable = false, length = 50)
    private String billNumber;

    @Column(name = "vendor_id", nullable = false, updatable = false)
    private UUID vendorId;

    @Column(name = "bill_date", nullable = false)
    private LocalDate billDate;

    @OneToMany(mappedBy = "bill", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("lineNumber")
    private List<PurchaseBillItem> items = new ArrayList<>();

    private PurchaseBill(TenantScope scope, String billNumber, UUID vendorId, LocalDate billDate,
                         LocalDate dueDate, String notes, BigDecimal vatRate) {
        super(scope, dueDate, notes, vatRate);
        this.billNumber = billNumber;
        this.vendorId = vendorId;
        this.billDate = billDate;
    }

    public static PurchaseBill create(TenantScope scope, String billNumber, UUID vendorId, LocalDate billDate,
                                      LocalDate dueDate, String notes, BigDecimal vatRate) {
        return new PurchaseBill(scope, billNumber, vendorId, billDate, dueDate, notes, vatRate);
    }

    public PurchaseBillItem addItem(UUID productId, String description, BigDecimal quantity, BigDecimal price) {
        PurchaseBillItem item = new PurchaseBillItem(this, items.size() + 1, productId, description, quantity, price);
        items.add(item);
        return item;
    }

    public DocumentTotals recalculate() {
        DocumentTotals totals = DocumentTotals.calculate(
            items.stream().map(PurchaseBillItem::getAmount).toList(), getVatRate());
        applyTotals(totals);
        return totals;
    }

    public PurchaseBillItem findItem(UUID itemId) {
        return items.stream()
            .filter(item -> item.getId().equals(itemId))
            .findFirst()
            .orElse(null);
    }

    @Override
    public String getDocumentLabel() {
        return "Bill " + billNumber;
    }

    @Override
    public String getNumber() {
        return billNumber;
    }
}
