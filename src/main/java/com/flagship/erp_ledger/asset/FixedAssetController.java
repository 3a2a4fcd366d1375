package com.flagship.erp_ledger.asset;

import com.flagship.erp_ledger.asset.dto.CreateFixedAssetRequest;
import com.flagship.erp_ledger.asset.dto.DepreciationRequest;
import com.flagship.erp_ledger.asset.dto.FixedAssetResponse;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.idempotency.IdempotencyService;
import com.flagship.erp_ledger.idempotency.IdempotentOperation;
import com.flagship.erp_ledger.idempotency.IdempotentResult;
import com.flagship.erp_ledger.observability.CorrelationContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/fixed-assets")
@RequiredArgsConstructor
public class FixedAssetController {

    private final FixedAssetService assetService;
    private final IdempotencyService idempotencyService;

    @PostMapping
    public ResponseEntity<FixedAssetResponse> create(TenantScope scope,
                                                     @Valid @RequestBody CreateFixedAssetRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(FixedAssetResponse.from(assetService.create(scope, request)));
    }

    @GetMapping
    public List<FixedAssetResponse> list(TenantScope scope,
                                         @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive) {
        return assetService.list(scope, includeInactive).stream().map(FixedAssetResponse::from).toList();
    }

    @GetMapping("/{id}")
    public FixedAssetResponse get(TenantScope scope, @PathVariable("id") UUID id) {
        return FixedAssetResponse.from(assetService.get(scope, id));
    }

    @PostMapping("/{id}/depreciation")
    public ResponseEntity<FixedAssetResponse> recordDepreciation(TenantScope scope, @PathVariable("id") UUID id,
                                                                 @RequestHeader(IdempotencyService.IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
                                                                 @Valid @RequestBody DepreciationRequest request) {
        IdempotentResult result = idempotencyService.execute(scope, idempotencyKey, IdempotentOperation.RECORD_DEPRECIATION,
            () -> assetService.recordDepreciation(scope, id, request.getAmount(), request.getDepreciationDate()).getId());
        CorrelationContext.setDocumentId(result.getResourceId());
        return ResponseEntity.status(result.responseStatus())
            .body(FixedAssetResponse.from(assetService.get(scope, result.getResourceId())));
    }
}
