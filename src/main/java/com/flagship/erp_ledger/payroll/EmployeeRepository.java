package com.flagship.erp_ledger.payroll;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EmployeeRepository extends JpaRepository<Employee, UUID> {

    Optional<Employee> findByIdAndBusinessId(UUID id, UUID businessId);

    List<Employee> findByBusinessIdOrderByFullNameAsc(UUID businessId);

    List<Employee> findByBusinessIdAndBranchIdOrderByFullNameAsc(UUID businessId, UUID branchId);

    List<Employee> findByBusinessIdAndBranchIdAndActiveTrueOrderByFullNameAsc(UUID businessId, UUID branchId);
}
