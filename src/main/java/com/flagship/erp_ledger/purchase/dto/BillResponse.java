package com.flagship.erp_ledger.purchase.dto;

import com.flagship.erp_ledger.common.SettlementStatus;
import com.flagship.erp_ledger.common.dto.DocumentLineResponse;
import com.flagship.erp_ledger.purchase.PurchaseBill;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class BillResponse {
    UUID id;
    String billNumber;
    UUID vendorId;
    UUID branchId;
    LocalDate billDate;
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

    public static BillResponse from(PurchaseBill bill) {
        return base(bill)
            .items(bill.getItems().stream().map(DocumentLineResponse::from).toList())
            .build();
    }

    public static BillResponse summary(PurchaseBill bill) {
        return base(bill).build();
    }

    private static BillResponseBuilder base(PurchaseBill bill) {
        return BillResponse.builder()
            .id(bill.getId())
            .billNumber(bill.getBillNumber())
            .vendorId(bill.getVendorId())
            .branchId(bill.getBranchId())
            .billDate(bill.getBillDate())
            .dueDate(bill.getDueDate())
            .notes(bill.getNotes())
            .vatRate(bill.getVatRate())
            .subTotal(bill.getSubTotal())
            .vatAmount(bill.getVatAmount())
            .totalAmount(bill.getTotalAmount())
            .paidAmount(bill.getPaidAmount())
            .outstanding(bill.getOutstanding())
            .status(bill.getStatus());
    }
}
