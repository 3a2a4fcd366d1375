package com.flagship.erp_ledger.common.dto;

import com.flagship.erp_ledger.common.DocumentLine;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class DocumentLineResponse {
    UUID id;
    int lineNumber;
    UUID productId;
    String description;
    BigDecimal quantity;
    BigDecimal price;
    BigDecimal amount;
    BigDecimal returnedQuantity;

    public static DocumentLineResponse from(DocumentLine line) {
        return DocumentLineResponse.builder()
            .id(line.getId())
            .lineNumber(line.getLineNumber())
            .productId(line.getProductId())
            .description(line.getDescription())
            .quantity(line.getQuantity())
            .price(line.getPrice())
            .amount(line.getAmount())
            .returnedQuantity(line.getReturnedQuantity())
            .build();
    }
}
