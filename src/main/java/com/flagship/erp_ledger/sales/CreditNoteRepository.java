package com.flagship.erp_ledger.sales;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CreditNoteRepository extends JpaRepository<CreditNote, UUID> {

    @EntityGraph(attributePaths = "items")
    Optional<CreditNote> findByIdAndBusinessId(UUID id, UUID businessId);

    @EntityGraph(attributePaths = "items")
    List<CreditNote> findByBusinessIdOrderByCreatedAtDesc(UUID businessId);

    @EntityGraph(attributePaths = "items")
    List<CreditNote> findByBusinessIdAndInvoiceIdOrderByCreatedAtDesc(UUID businessId, UUID invoiceId);
}
