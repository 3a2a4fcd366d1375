package com.flagship.erp_ledger.purchase.dto;

import com.flagship.erp_ledger.purchase.DebitNote;
import com.flagship.erp_ledger.purchase.DebitNoteItem;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class DebitNoteResponse {
    UUID id;
    String debitNoteNumber;
    UUID billId;
    UUID vendorId;
    LocalDate noteDate;
    String reason;
    BigDecimal totalAmount;
    List<Item> items;

    @Value
    public static class Item {
        UUID billItemId;
        UUID productId;
        BigDecimal quantity;
        BigDecimal price;
        BigDecimal amount;

        static Item from(DebitNoteItem item) {
            return new Item(item.getBillItemId(), item.getProductId(), item.getQuantity(), item.getPrice(),
                item.getAmount());
        }
    }

    public static DebitNoteResponse from(DebitNote note) {
        return DebitNoteResponse.builder()
            .id(note.getId())
            .debitNoteNumber(note.getDebitNoteNumber())
            .billId(note.getBillId())
            .vendorId(note.getVendorId())
            .noteDate(note.getNoteDate())
            .reason(note.getReason())
            .totalAmount(note.getTotalAmount())
            .items(note.getItems().stream().map(Item::from).toList())
            .build();
    }
}
