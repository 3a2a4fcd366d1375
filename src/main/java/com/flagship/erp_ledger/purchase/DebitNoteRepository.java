package com.flagship.erp_ledger.purchase;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DebitNoteRepository extends JpaRepository<DebitNote, UUID> {

    @EntityGraph(attributePaths = "items")
    Optional<DebitNote> findByIdAndBusinessId(UUID id, UUID businessId);

    @EntityGraph(attributePaths = "items")
    List<DebitNote> findByBusinessIdOrderByCreatedAtDesc(UUID businessId);

    @EntityGraph(attributePaths = "items")
    List<DebitNote> findByBusinessIdAndBillIdOrderByCreatedAtDesc(UUID businessId, UUID billId);
}
