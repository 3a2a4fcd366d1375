package com.flagship.erp_ledger.inventory;

import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.NotFoundException;
import com.flagship.erp_ledger.common.exception.ValidationException;
import com.flagship.erp_ledger.inventory.dto.CreateProductRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProductService {

    private final ProductRepository productRepository;

    @Transactional
    public Product create(TenantScope scope, CreateProductRequest request) {
        if (request.getSku() != null && productRepository.existsByBusinessIdAndSku(scope.getBusinessId(), request.getSku())) {
            throw new ValidationException("SKU already exists: " + request.getSku());
        }
        if (Money.isNegative(request.getOpeningStock())) {
            throw new ValidationException("Opening stock must not be negative");
        }
        Product product = productRepository.save(Product.create(scope, request.getName(), request.getSku(),
            request.getUnit(), request.getPurchasePrice(), request.getSalesPrice(),
            request.getOpeningStock(), request.getReorderLevel()));
        log.info("Product created: name={}, sku={}, openingStock={}",
                product.getName(), product.getSku(), product.getStockQuantity());
        return product;
    }

    @Transactional(readOnly = true)
    public Product get(TenantScope scope, UUID productId) {
        return productRepository.findByIdAndBusinessId(productId, scope.getBusinessId())
            .orElseThrow(() -> NotFoundException.of("Product", productId));
    }

    @Transactional(readOnly = true)
    public List<Product> list(TenantScope scope, boolean includeInactive) {
        return includeInactive
            ? productRepository.findByBusinessIdOrderByName(scope.getBusinessId())
            : productRepository.findByBusinessIdAndActiveTrueOrderByName(scope.getBusinessId());
    }

    @Transactional(readOnly = true)
    public List<Product> lowStock(TenantScope scope) {
        return productRepository.findLowStock(scope.getBusinessId());
    }

    @Transactional
    public Product deactivate(TenantScope scope, UUID productId) {
        Product product = get(scope, productId);
        product.deactivate();
        return product;
    }
}
