package com.flagship.erp_ledger.sales;

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
public interface SalesInvoiceRepository extends JpaRepository<SalesInvoice, UUID> {

    @EntityGraph(attributePaths = "items")
    Optional<SalesInvoice> findByIdAndBusinessId(UUID id, UUID businessId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM SalesInvoice i WHERE i.id = :id AND i.businessId = :businessId")
    Optional<SalesInvoice> findForUpdate(@Param("id") UUID id, @Param("businessId") UUID businessId);

    List<SalesInvoice> findByBusinessIdOrderByInvoiceDateDescCreatedAtDesc(UUID businessId);

    List<SalesInvoice> findByBusinessIdAndStatusOrderByInvoiceDateDescCreatedAtDesc(UUID businessId, SettlementStatus status);

    List<SalesInvoice> findByBusinessIdAndBranchIdOrderByInvoiceDateDescCreatedAtDesc(UUID businessId, UUID branchId);

    List<SalesInvoice> findByBusinessIdAndBranchIdAndStatusOrderByInvoiceDateDescCreatedAtDesc(UUID businessId, UUID branchId,
                                                                                            SettlementStatus status);

    List<SalesInvoice> findByBusinessIdAndStatusIn(UUID businessId, Collection<SettlementStatus> statuses);
}
