package com.flagship.payroll_ledger.payroll;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface PayComponentRepository extends JpaRepository<PayComponentEntity, UUID> {

    /**
     * Components for the given employees effective between {@code from} and {@code to}, inclusive.
     */
    List<PayComponentEntity> findByEmployeeIdInAndEffectiveDateBetween(Collection<String> employeeIds,
                                                                      LocalDate from, LocalDate to);
}
