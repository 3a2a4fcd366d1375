package com.flagship.erp_ledger.banking;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FundTransferRepository extends JpaRepository<FundTransfer, UUID> {

    Optional<FundTransfer> findByIdAndBusinessId(UUID id, UUID businessId);

    List<FundTransfer> findByBusinessIdOrderByTransferDateDescCreatedAtDesc(UUID businessId);

    @Query("SELECT t FROM FundTransfer t WHERE t.businessId = :businessId " +
           "AND (t.fromAccountId = :bankAccountId OR t.toAccountId = :bankAccountId) " +
           "ORDER BY t.transferDate DESC, t.createdAt DESC")
    List<FundTransfer> findByBankAccount(@Param("businessId") UUID businessId,
                                         @Param("bankAccountId") UUID bankAccountId);

    @Query("SELECT COUNT(t) > 0 FROM FundTransfer t WHERE t.fromAccountId = :bankAccountId OR t.toAccountId = :bankAccountId")
    boolean existsForBankAccount(@Param("bankAccountId") UUID bankAccountId);
}
