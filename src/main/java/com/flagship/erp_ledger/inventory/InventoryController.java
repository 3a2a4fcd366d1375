package com.flagship.erp_ledger.inventory;

import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.inventory.dto.CreateProductRequest;
import com.flagship.erp_ledger.inventory.dto.ProductResponse;
import com.flagship.erp_ledger.inventory.dto.StockAdjustmentRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/inventory/products")
@RequiredArgsConstructor
public class InventoryController {

    private final ProductService productService;
    private final StockService stockService;

    @GetMapping
    public List<ProductResponse> list(TenantScope scope,
                                      @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive) {
        return productService.list(scope, includeInactive).stream().map(ProductResponse::from).toList();
    }

    @PostMapping
    public ResponseEntity<ProductResponse> create(TenantScope scope, @Valid @RequestBody CreateProductRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ProductResponse.from(productService.create(scope, request)));
    }

    @GetMapping("/low-stock")
    public List<ProductResponse> lowStock(TenantScope scope) {
        return productService.lowStock(scope).stream().map(ProductResponse::from).toList();
    }

    @GetMapping("/{id}")
    public ProductResponse get(TenantScope scope, @PathVariable("id") UUID id) {
        return ProductResponse.from(productService.get(scope, id));
    }

    @PostMapping("/{id}/adjust-stock")
    public ProductResponse adjustStock(TenantScope scope, @PathVariable("id") UUID id,
                                       @Valid @RequestBody StockAdjustmentRequest request) {
        return ProductResponse.from(stockService.adjust(scope, id, request.getQuantityChange(), request.getReason()));
    }

    @DeleteMapping("/{id}")
    public ProductResponse deactivate(TenantScope scope, @PathVariable("id") UUID id) {
        return ProductResponse.from(productService.deactivate(scope, id));
    }
}
