package com.flagship.erp_ledger.asset;

import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.ValidationException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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
import java.time.LocalDate;
import java.util.UUID;

/**
 * A depreciable asset. Book value is always purchase cost minus accumulated depreciation, and accumulated
 * depreciation never exceeds cost minus salvage value.
 */
@Entity
@Table(name = "fixed_assets")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class FixedAsset {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "business_id", nullable = false, updatable = false)
    private UUID businessId;

    @Column(name = "branch_id", updatable = false)
    private UUID branchId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "asset_code", length = 50)
    private String assetCode;

    @Column(name = "purchase_date", nullable = false)
    private LocalDate purchaseDate;

    @Column(name = "purchase_cost", nullable = false, precision = 15, scale = 2)
    private BigDecimal purchaseCost;

    @Column(name = "salvage_value", nullable = false, precision = 15, scale = 2)
    private BigDecimal salvageValue;

    @Column(name = "useful_life_years", nullable = false)
    private int usefulLifeYears;

    @Enumerated(EnumType.STRING)
    @Column(name = "depreciation_method", nullable = false, length = 30)
    private DepreciationMethod depreciationMethod;

    @Column(name = "accumulated_depreciation", nullable = false, precision = 15, scale = 2)
    private BigDecimal accumulatedDepreciation;

    @Column(name = "book_value", nullable = false, precision = 15, scale = 2)
    private BigDecimal bookValue;

    @Column(name = "last_depreciation_date")
    private LocalDate lastDepreciationDate;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static FixedAsset create(TenantScope scope, String name, String assetCode, LocalDate purchaseDate,
                                    BigDecimal purchaseCost, BigDecimal salvageValue, int usefulLifeYears) {
        BigDecimal cost = Money.of(purchaseCost);
        BigDecimal salvage = Money.of(salvageValue);
        if (cost.signum() < 0 || salvage.signum() < 0) {
            throw new ValidationException("Purchase cost and salvage value must not be negative");
        }
        if (salvage.compareTo(cost) > 0) {
            throw new ValidationException("Salvage value cannot exceed purchase cost");
        }
        if (usefulLifeYears <= 0) {
            throw new ValidationException("Useful life must be at least one year");
        }
        FixedAsset asset = new FixedAsset();
        asset.businessId = scope.getBusinessId();
        asset.branchId = scope.getBranchId();
        asset.name = name;
        asset.assetCode = assetCode;
        asset.purchaseDate = purchaseDate;
        asset.purchaseCost = cost;
        asset.salvageValue = salvage;
        asset.usefulLifeYears = usefulLifeYears;
        asset.depreciationMethod = DepreciationMethod.STRAIGHT_LINE;
        asset.accumulatedDepreciation = Money.ZERO;
        asset.bookValue = cost;
        asset.active = true;
        return asset;
    }

    public BigDecimal getDepreciableAmount() {
        return purchaseCost.subtract(salvageValue);
    }

    public BigDecimal getRemainingDepreciable() {
        return getDepreciableAmount().subtract(accumulatedDepreciation);
    }

    /**
     * Straight-line charge for one year: (cost - salvage) / life, rounded to cents.
     */
    public BigDecimal annualDepreciation() {
        return getDepreciableAmount().divide(BigDecimal.valueOf(usefulLifeYears), Money.SCALE, Money.ROUNDING);
    }

    public void depreciate(BigDecimal amount, LocalDate date) {
        if (!Money.isPositive(amount)) {
            throw new ValidationException("Depreciation amount must be greater than zero");
        }
        if (!active) {
            throw new ValidationException("Asset " + name + " is inactive");
        }
        if (amount.compareTo(getRemainingDepreciable()) > 0) {
            throw new ValidationException("Depreciation of " + amount + " exceeds the remaining depreciable amount "
                + getRemainingDepreciable() + " of asset " + name);
        }
        this.accumulatedDepreciation = Money.of(accumulatedDepreciation.add(amount));
        this.bookValue = purchaseCost.subtract(accumulatedDepreciation);
        this.lastDepreciationDate = date;
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
