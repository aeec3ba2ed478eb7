package com.flagship.payroll_ledger.payroll;

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
public interface PayrollRunRepository extends JpaRepository<PayrollRunEntity, UUID> {

    /**
     * Loads a run with a row lock (SELECT ... FOR UPDATE) held until the transaction ends.
     * Serializes concurrent close attempts on the same run.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM PayrollRunEntity r WHERE r.id = :id")
    Optional<PayrollRunEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Locks every run of a period, in id order.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM PayrollRunEntity r WHERE r.periodStart = :periodStart ORDER BY r.id")
    List<PayrollRunEntity> findByPeriodStartForUpdate(@Param("periodStart") LocalDate periodStart);
}
