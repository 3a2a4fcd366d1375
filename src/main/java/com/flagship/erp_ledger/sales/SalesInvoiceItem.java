package com.flagship.erp_ledger.sales;

import com.flagship.erp_ledger.common.DocumentLine;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "sales_invoice_items")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SalesInvoiceItem extends DocumentLine {

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "invoice_id", nullable = false, updatable = false)
    private SalesInvoice invoice;

    SalesInvoiceItem(SalesInvoice invoice, int lineNumber, UUID productId, String description,
                     BigDecimal quantity, BigDecimal price) {
        super(lineNumber, productId, description, quantity, price);
        this.invoice = invoice;
    }
}
