package com.flagship.erp_ledger.asset.dto;

import com.flagship.erp_ledger.asset.DepreciationMethod;
import com.flagship.erp_ledger.asset.FixedAsset;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class FixedAssetResponse {
    UUID id;
    String name;
    String assetCode;
    LocalDate purchaseDate;
    BigDecimal purchaseCost;
    BigDecimal salvageValue;
    int usefulLifeYears;
    DepreciationMethod depreciationMethod;
    BigDecimal accumulatedDepreciation;
    BigDecimal bookValue;
    BigDecimal annualDepreciation;
    LocalDate lastDepreciationDate;
    boolean active;

    public static FixedAssetResponse from(FixedAsset asset) {
        return FixedAssetResponse.builder()
            .id(asset.getId())
            .name(asset.getName())
            .assetCode(asset.getAssetCode())
            .purchaseDate(asset.getPurchaseDate())
            .purchaseCost(asset.getPurchaseCost())
            .salvageValue(asset.getSalvageValue())
            .usefulLifeYears(asset.getUsefulLifeYears())
            .depreciationMethod(asset.getDepreciationMethod())
            .accumulatedDepreciation(asset.getAccumulatedDepreciation())
            .bookValue(asset.getBookValue())
            .annualDepreciation(asset.annualDepreciation())
            .lastDepreciationDate(asset.getLastDepreciationDate())
            .active(asset.isActive())
            .build();
    }
}
