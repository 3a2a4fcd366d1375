package com.flagship.erp_ledger.inventory;

import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.InsufficientStockException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "products")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "business_id", nullable = false, updatable = false)
    private UUID businessId;

    @Column(name = "branch_id")
    private UUID branchId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "sku", length = 50)
    private String sku;

    @Column(name = "unit", length = 20)
    private String unit;

    @Column(name = "purchase_price", nullable = false, precision = 15, scale = 2)
    private BigDecimal purchasePrice;

    @Column(name = "sales_price", nullable = false, precision = 15, scale = 2)
    private BigDecimal salesPrice;

    @Column(name = "stock_quantity", nullable = false, precision = 15, scale = 2)
    private BigDecimal stockQuantity;

    @Column(name = "reorder_level", nullable = false, precision = 15, scale = 2)
    private BigDecimal reorderLevel;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static Product create(TenantScope scope, String name, String sku, String unit,
                                 BigDecimal purchasePrice, BigDecimal salesPrice,
                                 BigDecimal openingStock, BigDecimal reorderLevel) {
        Product product = new Product();
        product.businessId = scope.getBusinessId();
        product.branchId = scope.getBranchId();
        product.name = name;
        product.sku = sku;
        product.unit = unit;
        product.purchasePrice = Money.orZero(purchasePrice);
        product.salesPrice = Money.orZero(salesPrice);
        product.stockQuantity = Money.orZero(openingStock);
        product.reorderLevel = Money.orZero(reorderLevel);
        product.active = true;
        return product;
    }

    /**
     * Changes stock by {@code delta}; stock may never go below zero.
     */
    public void adjustStock(BigDecimal delta) {
        BigDecimal updated = stockQuantity.add(delta);
        if (updated.signum() < 0) {
            throw new InsufficientStockException(id, name, stockQuantity, delta.negate());
        }
        this.stockQuantity = updated;
    }

    public boolean isLowStock() {
        return stockQuantity.compareTo(reorderLevel) <= 0;
    }

    public void deactivate() {
        this.active = false;
    }

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
