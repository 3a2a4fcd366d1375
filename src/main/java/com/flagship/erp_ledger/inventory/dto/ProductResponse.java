package com.flagship.erp_ledger.inventory.dto;

import com.flagship.erp_ledger.inventory.Product;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class ProductResponse {
    UUID id;
    String name;
    String sku;
    String unit;
    BigDecimal purchasePrice;
    BigDecimal salesPrice;
    BigDecimal stockQuantity;
    BigDecimal reorderLevel;
    boolean lowStock;
    boolean active;

    public static ProductResponse from(Product product) {
        return ProductResponse.builder()
            .id(product.getId())
            .name(product.getName())
            .sku(product.getSku())
            .unit(product.getUnit())
            .purchasePrice(product.getPurchasePrice())
            .salesPrice(product.getSalesPrice())
            .stockQuantity(product.getStockQuantity())
            .reorderLevel(product.getReorderLevel())
            .lowStock(product.isLowStock())
            .active(product.isActive())
            .build();
    }
}
