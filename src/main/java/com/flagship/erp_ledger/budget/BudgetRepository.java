package com.flagship.erp_ledger.budget;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BudgetRepository extends JpaRepository<Budget, UUID> {

    @EntityGraph(attributePaths = "items")
    Optional<Budget> findByIdAndBusinessId(UUID id, UUID businessId);

    @EntityGraph(attributePaths = "items")
    List<Budget> findByBusinessIdOrderByFiscalYearDescNameAsc(UUID businessId);

    boolean existsByBusinessIdAndNameAndFiscalYear(UUID businessId, String name, int fiscalYear);
}
