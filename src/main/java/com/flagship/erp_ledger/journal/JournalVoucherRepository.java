package com.flagship.erp_ledger.journal;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface JournalVoucherRepository extends JpaRepository<JournalVoucher, UUID> {

    Optional<JournalVoucher> findByIdAndBusinessId(UUID id, UUID businessId);

    List<JournalVoucher> findByBusinessIdOrderByVoucherDateDescCreatedAtDesc(UUID businessId);

    List<JournalVoucher> findByBusinessIdAndBranchIdOrderByVoucherDateDescCreatedAtDesc(UUID businessId, UUID branchId);
}
