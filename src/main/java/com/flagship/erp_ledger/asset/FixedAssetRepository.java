package com.flagship.erp_ledger.asset;

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
public interface FixedAssetRepository extends JpaRepository<FixedAsset, UUID> {

    Optional<FixedAsset> findByIdAndBusinessId(UUID id, UUID businessId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM FixedAsset a WHERE a.id = :id AND a.businessId = :businessId")
    Optional<FixedAsset> findForUpdate(@Param("id") UUID id, @Param("businessId") UUID businessId);

    List<FixedAsset> findByBusinessIdOrderByPurchaseDateDesc(UUID businessId);

    List<FixedAsset> findByBusinessIdAndActiveTrueOrderByPurchaseDateDesc(UUID businessId);
}
