package com.flagship.erp_ledger.payroll;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PayslipRepository extends JpaRepository<Payslip, UUID> {

    Optional<Payslip> findByIdAndBusinessId(UUID id, UUID businessId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Payslip p WHERE p.id = :id AND p.businessId = :businessId")
    Optional<Payslip> findForUpdate(@Param("id") UUID id, @Param("businessId") UUID businessId);

    boolean existsByEmployeeIdAndPeriodStartAndPeriodEnd(UUID employeeId, LocalDate periodStart, LocalDate periodEnd);

    List<Payslip> findByBusinessIdOrderByPeriodStartDescPayslipNumberDesc(UUID businessId);

    List<Payslip> findByBusinessIdAndEmployeeIdOrderByPeriodStartDesc(UUID businessId, UUID employeeId);

    /**
     * Payslips whose period lies within [start, end].
     */
    @Query("SELECT p FROM Payslip p WHERE p.businessId = :businessId " +
           "AND p.periodStart >= :start AND p.periodEnd <= :end ORDER BY p.payslipNumber")
    List<Payslip> findWithinPeriod(@Param("businessId") UUID businessId,
                                   @Param("start") LocalDate start,
                                   @Param("end") LocalDate end);
}
