package com.flagship.erp_ledger.inventory;

import com.flagship.erp_ledger.common.Money;
import com.flagship.erp_ledger.common.TenantScope;
import com.flagship.erp_ledger.common.exception.InsufficientStockException;
import com.flagship.erp_ledger.common.exception.NotFoundException;
import com.flagship.erp_ledger.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Applies the stock side of documents.
 *
 * Movements for the same product are netted, every product is locked and checked, and only then is any
 * quantity changed: a document either moves all its stock or none.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StockService {

    private final ProductRepository productRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public List<Product> apply(TenantScope scope, List<StockMovement> movements) {
        Map<UUID, BigDecimal> netChanges = new LinkedHashMap<>();
        for (StockMovement movement : movements) {
            netChanges.merge(movement.getProductId(), movement.getQuantityChange(), BigDecimal::add);
        }

        List<Product> products = new ArrayList<>(netChanges.size());
        for (Map.Entry<UUID, BigDecimal> change : netChanges.entrySet()) {
            Product product = lockProduct(scope, change.getKey());
            if (!product.isActive() && change.getValue().signum() < 0) {
                throw new ValidationException("Product " + product.getName() + " is inactive");
            }
            BigDecimal resulting = product.getStockQuantity().add(change.getValue());
            if (resulting.signum() < 0) {
                throw new InsufficientStockException(product.getId(), product.getName(),
                    product.getStockQuantity(), change.getValue().negate());
            }
            products.add(product);
        }

        for (Product product : products) {
            product.adjustStock(netChanges.get(product.getId()));
            log.debug("Stock of {} now {}", product.getName(), product.getStockQuantity());
        }
        return products;
    }

    /**
     * Manual adjustment outside any document, e.g. after a stock count.
     */
    @Transactional
    public Product adjust(TenantScope scope, UUID productId, BigDecimal delta, String reason) {
        if (Money.isZero(delta)) {
            throw new ValidationException("Adjustment quantity must not be zero");
        }
        Product product = lockProduct(scope, productId);
        product.adjustStock(delta);
        log.info("Stock adjusted: product={}, delta={}, newQuantity={}, reason={}",
                product.getName(), delta, product.getStockQuantity(), reason);
        return product;
    }

    private Product lockProduct(TenantScope scope, UUID productId) {
        return productRepository.findForUpdate(productId, scope.getBusinessId())
            .orElseThrow(() -> NotFoundException.of("Product", productId));
    }
}
