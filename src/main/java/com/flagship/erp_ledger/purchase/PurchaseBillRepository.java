package com.flagship.erp_ledger.purchase;

import com.flagship.erp_ledger.common.SettlementStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PurchaseBillRepository extends JpaRepository<PurchaseBill, UUID> {

    @EntityGraph(attributePaths = "items")
    Optional<PurchaseBill> findByIdAndBusinessId(UUID id, UUID businessId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM PurchaseBill b WHERE b.id = :id AND b.businessId = :businessId")
    Optional<PurchaseBill> findForUpdate(@Param("id") UUID id, @Param("businessId") UUID businessId);

    boolean existsByBusinessIdAndBillNumber(UUID businessId, String billNumber);

    List<PurchaseBill> findByBusinessIdOrderByBillDateDescCreatedAtDesc(UUID businessId);

    List<PurchaseBill> findByBusinessIdAndStatusOrderByBillDateDescCreatedAtDesc(UUID businessId, SettlementStatus status);

    List<PurchaseBill> findByBusinessIdAndBranchIdOrderByBillDateDescCreatedAtDesc(UUID businessId, UUID branchId);

    List<PurchaseBill> findByBusinessIdAndBranchIdAndStatusOrderByBillDateDescCreatedAtDesc(UUID businessId, UUID branchId,
                                                                                         SettlementStatus status);

    List<PurchaseBill> findByBusinessIdAndStatusIn(UUID businessId, Collection<SettlementStatus> statuses);
}
