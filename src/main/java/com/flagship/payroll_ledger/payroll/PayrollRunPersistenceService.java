package com.flagship.payroll_ledger.payroll;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the payroll domain objects and their JPA entities.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayrollRunPersistenceService {

    private final PayrollRunRepository runRepository;
    private final PayrollRunLineRepository lineRepository;
    private final PayComponentRepository componentRepository;

    @Transactional
    public PayrollRunEntity save(PayrollRun run) {
        PayrollRunEntity saved = runRepository.save(PayrollRunEntity.fromDomain(run));
        log.debug("Saved payroll run {} for period {}", saved.getId(), run.getPeriod());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<PayrollRun> findById(UUID runId) {
        return runRepository.findById(runId).map(PayrollRunEntity::toDomain);
    }

    /**
     * Loads the run entity with a row lock. Must be called inside a transaction.
     */
    @Transactional
    public Optional<PayrollRunEntity> findByIdForUpdate(UUID runId) {
        return runRepository.findByIdForUpdate(runId);
    }

    /**
     * Applies a state change to a locked entity, recording the journal when the run closed with one.
     */
    @Transactional
    public PayrollRunEntity update(PayrollRunEntity entity, PayrollRun run) {
        entity.updateFromDomain(run);
        if (run.isClosed() && run.getJournalId() != null) {
            entity.setJournalId(run.getJournalId());
        }
        PayrollRunEntity saved = runRepository.save(entity);
        log.debug("Updated payroll run {} status={}", saved.getId(), saved.getStatus());
        return saved;
    }

    /**
     * Writes a line immediately so that a second line for the same employee and period
     * fails here rather than at commit.
     */
    @Transactional
    public PayrollRunLine saveLine(PayrollRunLine line, YearMonth period) {
        return lineRepository.saveAndFlush(PayrollRunLineEntity.fromDomain(line, period)).toDomain();
    }

    @Transactional
    public PayComponent saveComponent(PayComponent component) {
        return componentRepository.save(PayComponentEntity.fromDomain(component)).toDomain();
    }

    @Transactional(readOnly = true)
    public List<PayrollRunLine> findLines(UUID runId) {
        return lineRepository.findByPayrollRunIdOrderByEmployeeIdAsc(runId).stream()
            .map(PayrollRunLineEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public boolean hasLineInPeriod(String employeeId, YearMonth period) {
        return lineRepository.existsByEmployeeIdAndPeriodStart(employeeId, period.atDay(1));
    }

    /**
     * Row-locks all runs of a period. Must be called inside a transaction.
     */
    @Transactional
    public List<PayrollRunEntity> lockRunsInPeriod(YearMonth period) {
        return runRepository.findByPeriodStartForUpdate(period.atDay(1));
    }

    @Transactional(readOnly = true)
    public boolean isEmployeeInClosedRun(String employeeId, YearMonth period) {
        return lineRepository.existsInClosedPeriod(employeeId, period.atDay(1));
    }

    /**
     * Reads the run's lines and the components effective in its period for the employees on it.
     */
    @Transactional(readOnly = true)
    public PayrollRunSnapshot loadSnapshot(PayrollRun run) {
        List<PayrollRunLine> lines = findLines(run.getId());
        if (lines.isEmpty()) {
            return new PayrollRunSnapshot(run, lines, List.of());
        }
        List<String> employeeIds = lines.stream().map(PayrollRunLine::getEmployeeId).toList();
        List<PayComponent> components = componentRepository
            .findByEmployeeIdInAndEffectiveDateBetween(employeeIds, run.getPeriodStart(), run.getPeriodEnd())
            .stream()
            .map(PayComponentEntity::toDomain)
            .toList();
        return new PayrollRunSnapshot(run, lines, components);
    }
}
