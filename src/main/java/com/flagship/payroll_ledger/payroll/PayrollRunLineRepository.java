package com.flagship.payroll_ledger.payroll;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Repository
public interface PayrollRunLineRepository extends JpaRepository<PayrollRunLineEntity, UUID> {

    List<PayrollRunLineEntity> findByPayrollRunIdOrderByEmployeeIdAsc(UUID payrollRunId);

    boolean existsByEmployeeIdAndPeriodStart(String employeeId, LocalDate periodStart);

    /**
     * Whether the employee is on a run for the given period that is no longer OPEN.
     */
    @Query("SELECT CASE WHEN COUNT(l) > 0 THEN true ELSE false END " +
           "FROM PayrollRunLineEntity l, PayrollRunEntity r " +
           "WHERE l.payrollRunId = r.id AND l.employeeId = :employeeId " +
           "AND l.periodStart = :periodStart AND r.status <> com.flagship.payroll_ledger.payroll.PayrollRunStatus.OPEN")
    boolean existsInClosedPeriod(@Param("employeeId") String employeeId, @Param("periodStart") LocalDate periodStart);
}
