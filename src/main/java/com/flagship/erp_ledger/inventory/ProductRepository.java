package com.flagship.erp_ledger.inventory;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProductRepository extends JpaRepository<Product, UUID> {

    Optional<Product> findByIdAndBusinessId(UUID id, UUID businessId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Product p WHERE p.id = :id AND p.businessId = :businessId")
    Optional<Product> findForUpdate(@Param("id") UUID id, @Param("businessId") UUID businessId);

    List<Product> findByBusinessIdAndActiveTrueOrderByName(UUID businessId);

    List<Product> findByBusinessIdOrderByName(UUID businessId);

    @Query("SELECT p FROM Product p WHERE p.businessId = :businessId AND p.active = true " +
           "AND p.stockQuantity <= p.reorderLevel ORDER BY p.stockQuantity")
    List<Product> findLowStock(@Param("businessId") UUID businessId);

    boolean existsByBusinessIdAndSku(UUID businessId, String sku);
}
