package com.flagship.erp_ledger.asset;

import com.flagship.erp_ledger.asset.dto.CreateFixedAssetRequest;
import com.flagship.erp_ledger.common.DocumentType;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.NotFoundException;
import com.flagship.erp_ledger.ledger.LedgerService;
import com.flagship.erp_ledger.posting.DocumentRef;
import com.flagship.erp_ledger.posting.PostingAccounts;
import com.flagship.erp_ledger.posting.PostingConfigurationService;
import com.flagship.erp_ledger.posting.PostingRules;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static com.flagship.erp_ledger.posting.WellKnownAccount.ACCUMULATED_DEPRECIATION;
import static com.flagship.erp_ledger.posting.WellKnownAccount.DEPRECIATION_EXPENSE;

@Service
@RequiredArgsConstructor
@Slf4j
public class FixedAssetService {

    private final FixedAssetRepository assetRepository;
    private final PostingConfigurationService postingConfiguration;
    private final PostingRules postingRules;
    private final LedgerService ledgerService;

    @Transactional
    public FixedAsset create(TenantScope scope, CreateFixedAssetRequest request) {
        FixedAsset asset = assetRepository.save(FixedAsset.create(scope, request.getName(), request.getAssetCode(),
            request.getPurchaseDate(), request.getPurchaseCost(), request.getSalvageValue(),
            request.getUsefulLifeYears()));
        log.info("Fixed asset registered: name={}, cost={}, life={}y", asset.getName(), asset.getPurchaseCost(),
                asset.getUsefulLifeYears());
        return asset;
    }

    @Transactional(readOnly = true)
    public FixedAsset get(TenantScope scope, UUID assetId) {
        return assetRepository.findByIdAndBusinessId(assetId, scope.getBusinessId())
            .orElseThrow(() -> NotFoundException.of("Fixed asset", assetId));
    }

    @Transactional(readOnly = true)
    public List<FixedAsset> list(TenantScope scope, boolean includeInactive) {
        return includeInactive
            ? assetRepository.findByBusinessIdOrderByPurchaseDateDesc(scope.getBusinessId())
            : assetRepository.findByBusinessIdAndActiveTrueOrderByPurchaseDateDesc(scope.getBusinessId());
    }

    @Transactional(readOnly = true)
    public BigDecimal annualDepreciation(TenantScope scope, UUID assetId) {
        return get(scope, assetId).annualDepreciation();
    }

    /**
     * Dr Depreciation Expense, Cr Accumulated Depreciation. The entries carry document type FIXED_ASSET and
     * the asset's id.
     */
    @Transactional
    public FixedAsset recordDepreciation(TenantScope scope, UUID assetId, BigDecimal amount, LocalDate date) {
        FixedAsset asset = assetRepository.findForUpdate(assetId, scope.getBusinessId())
            .orElseThrow(() -> NotFoundException.of("Fixed asset", assetId));
        PostingAccounts accounts = postingConfiguration.forTenant(scope.getBusinessId());
        accounts.requireAll(DEPRECIATION_EXPENSE, ACCUMULATED_DEPRECIATION);

        LocalDate depreciationDate = date != null ? date : LocalDate.now();
        asset.depreciate(amount, depreciationDate);

        DocumentRef ref = DocumentRef.builder()
            .businessId(asset.getBusinessId())
            .branchId(asset.getBranchId() != null ? asset.getBranchId() : scope.getBranchId())
            .documentType(DocumentType.FIXED_ASSET)
            .documentId(asset.getId())
            .documentNumber(asset.getAssetCode())
            .transactionDate(depreciationDate)
            .build();
        ledgerService.post(postingRules.depreciation(ref, asset.getName(), amount, accounts));

        log.info("Depreciation recorded: asset={}, amount={}, accumulated={}, bookValue={}",
                asset.getName(), amount, asset.getAccumulatedDepreciation(), asset.getBookValue());
        return asset;
    }
}
