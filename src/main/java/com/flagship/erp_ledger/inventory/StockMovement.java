package com.flagship.erp_ledger.inventory;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Signed stock change for one product: positive receives goods, negative issues them.
 */
@Value
public class StockMovement {
    UUID productId;
    BigDecimal quantityChange;

    public static StockMovement in(UUID productId, BigDecimal quantity) {
        return new StockMovement(productId, quantity);
    }

    public static StockMovement out(UUID productId, BigDecimal quantity) {
        return new StockMovement(productId, quantity.negate());
    }
}
