package com.flagship.erp_ledger.banking;

import jakarta.persistence.LockModeType;
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
public interface BankAccountRepository extends JpaRepository<BankAccount, UUID> {

    Optional<BankAccount> findByIdAndBusinessId(UUID id, UUID businessId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM BankAccount b WHERE b.id = :id AND b.businessId = :businessId")
    Optional<BankAccount> findForUpdate(@Param("id") UUID id, @Param("businessId") UUID businessId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM BankAccount b WHERE b.businessId = :businessId AND b.chartAccountId = :chartAccountId")
    Optional<BankAccount> findByChartAccountForUpdate(@Param("businessId") UUID businessId,
                                                      @Param("chartAccountId") UUID chartAccountId);

    /**
     * Bank accounts backed by any of the given chart accounts, locked and in a stable order.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM BankAccount b WHERE b.businessId = :businessId AND b.chartAccountId IN :chartAccountIds " +
           "ORDER BY b.id")
    List<BankAccount> findLinkedForUpdate(@Param("businessId") UUID businessId,
                                          @Param("chartAccountIds") Collection<UUID> chartAccountIds);

    boolean existsByChartAccountId(UUID chartAccountId);

    List<BankAccount> findByBusinessIdOrderByAccountName(UUID businessId);

    List<BankAccount> findByBusinessIdAndActiveTrueOrderByAccountName(UUID businessId);
}
