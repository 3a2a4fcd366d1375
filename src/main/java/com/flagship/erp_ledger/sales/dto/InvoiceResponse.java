package com.flagship.erp_ledger.sales.dto;

import com.flagship.erp_ledger.common.SettlementStatus;
import com.flagship.erp_ledger.common.dto.DocumentLineResponse;
import com.flagship.erp_ledger.sales.SalesInvoice;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class InvoiceResponse {
    UUID id;
    String invoiceNumber;
    UUID customerId;
    UUID branchId;
    LocalDate invoiceDate;
    LocalDate dueDate;
    String notes;
    BigDecimal vatRate;
    BigDecimal subTotal;
    BigDecimal vatAmount;
    BigDecimal totalAmount;
    BigDecimal paidAmount;
    BigDecimal outstanding;
    SettlementStatus status;
    List<DocumentLineResponse> items;

    public static InvoiceResponse from(SalesInvoice invoice) {
        return base(invoice)
            .items(invoice.getItems().stream().map(DocumentLineResponse::from).toList())
            .build();
    }

    /**
     * Header fields only, for listings.
     */
    public static InvoiceResponse summary(SalesInvoice invoice) {
        return base(invoice).build();
    }

    private static InvoiceResponseBuilder base(SalesInvoice invoice) {
        return InvoiceResponse.builder()
            .id(invoice.getId())
            .invoiceNumber(invoice.getInvoiceNumber())
            .customerId(invoice.getCustomerId())
            .branchId(invoice.getBranchId())
            .invoiceDate(invoice.getInvoiceDate())
            .dueDate(invoice.getDueDate())
            .notes(invoice.getNotes())
            .vatRate(invoice.getVatRate())
            .subTotal(invoice.getSubTotal())
            .vatAmount(invoice.getVatAmount())
            .totalAmount(invoice.getTotalAmount())
            .paidAmount(invoice.getPaidAmount())
            .outstanding(invoice.getOutstanding())
            .status(invoice.getStatus());
    }
}
