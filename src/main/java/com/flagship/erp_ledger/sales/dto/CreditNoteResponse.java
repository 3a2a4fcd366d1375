package com.flagship.erp_ledger.sales.dto;

import com.flagship.erp_ledger.sales.CreditNote;
import com.flagship.erp_ledger.sales.CreditNoteItem;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class CreditNoteResponse {
    UUID id;
    String creditNoteNumber;
    UUID invoiceId;
    UUID customerId;
    LocalDate noteDate;
    String reason;
    BigDecimal totalAmount;
    List<Item> items;

    @Value
    public static class Item {
        UUID invoiceItemId;
        UUID productId;
        BigDecimal quantity;
        BigDecimal price;
        BigDecimal amount;

        static Item from(CreditNoteItem item) {
            return new Item(item.getInvoiceItemId(), item.getProductId(), item.getQuantity(), item.getPrice(),
                item.getAmount());
        }
    }

    public static CreditNoteResponse from(CreditNote note) {
        return CreditNoteResponse.builder()
            .id(note.getId())
            .creditNoteNumber(note.getCreditNoteNumber())
            .invoiceId(note.getInvoiceId())
            .customerId(note.getCustomerId())
            .noteDate(note.getNoteDate())
            .reason(note.getReason())
            .totalAmount(note.getTotalAmount())
            .items(note.getItems().stream().map(Item::from).toList())
            .build();
    }
}
