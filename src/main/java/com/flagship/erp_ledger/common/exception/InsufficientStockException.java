package com.flagship.erp_ledger.common.exception;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.UUID;

@Getter
public class InsufficientStockException extends ValidationException {

    private final UUID productId;

    public InsufficientStockException(UUID productId, String productName, BigDecimal available, BigDecimal requested) {
        super("NEGATIVE_STOCK", String.format(
                "Insufficient stock for %s: available=%s, requested=%s", productName, available, requested));
        this.productId = productId;
    }
}
