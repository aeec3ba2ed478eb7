package com.flagship.payroll_ledger.payroll;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * State machine of payroll runs and validation of their inputs.
 */
class PayrollRunTest {

    private final PayrollRun run = PayrollRun.create(UUID.randomUUID(), "January 2024", YearMonth.of(2024, 1));

    @Test
    @DisplayName("New run is OPEN and spans its calendar month")
    void testCreate() {
        assertEquals(PayrollRunStatus.OPEN, run.getStatus());
        assertTrue(run.isOpen());
        assertNull(run.getJournalId());
        assertEquals(LocalDate.of(2024, 1, 1), run.getPeriodStart());
        assertEquals(LocalDate.of(2024, 1, 31), run.getPeriodEnd());
    }

    @Test
    @DisplayName("OPEN -> CLOSING -> CLOSED records the journal and close time")
    void testCloseTransitions() {
        UUID journalId = UUID.randomUUID();

        PayrollRun closing = run.startClosing();
        PayrollRun closed = closing.close(journalId);

        assertEquals(PayrollRunStatus.CLOSING, closing.getStatus());
        assertEquals(PayrollRunStatus.CLOSED, closed.getStatus());
        assertEquals(journalId, closed.getJournalId());
        assertNotNull(closed.getClosedAt());
        assertEquals(run.getId(), closed.getId());
        assertEquals(PayrollRunStatus.OPEN, run.getStatus(), "Transitions must not mutate the original");
    }

    @Test
    @DisplayName("A run can close without a journal")
    void testCloseWithoutJournal() {
        PayrollRun closed = run.startClosing().close(null);

        assertTrue(closed.isClosed());
        assertNull(closed.getJournalId());
    }

    @Test
    @DisplayName("Closed runs cannot be closed again")
    void testCloseTwice_ShouldFail() {
        PayrollRun closed = run.startClosing().close(UUID.randomUUID());

        assertThrows(IllegalStateException.class, closed::startClosing);
        assertThrows(IllegalStateException.class, () -> closed.close(UUID.randomUUID()));
    }

    @Test
    @DisplayName("Run requires a name and a period")
    void testCreateValidation() {
        assertThrows(IllegalArgumentException.class, () -> PayrollRun.create(UUID.randomUUID(), " ", YearMonth.now()));
        assertThrows(IllegalArgumentException.class, () -> PayrollRun.create(UUID.randomUUID(), "No period", null));
    }

    @Test
    @DisplayName("Line figures are scaled to cents, missing figures default to zero, negatives are rejected")
    void testLineValidation() {
        PayrollRunLine line = PayrollRunLine.create(run.getId(), "E001", "Ada", new BigDecimal("100"),
            null, new BigDecimal("12.345"), null, null);

        assertEquals(new BigDecimal("100.00"), line.getNetPay());
        assertEquals(new BigDecimal("0.00"), line.getIncomeTax());
        assertEquals(new BigDecimal("12.35"), line.getAnnualPension());

        assertThrows(IllegalArgumentException.class, () -> PayrollRunLine.create(run.getId(), "E001", "Ada",
            new BigDecimal("-1"), null, null, null, null));
        assertThrows(IllegalArgumentException.class, () -> PayrollRunLine.create(run.getId(), "", "Ada",
            BigDecimal.ONE, null, null, null, null));
    }

    @Test
    @DisplayName("Pay components must have a positive amount")
    void testComponentValidation() {
        LocalDate date = LocalDate.of(2024, 1, 10);

        PayComponent component = PayComponent.create("E001", PayComponentType.DEDUCTION, new BigDecimal("5"), date, null);
        assertEquals(new BigDecimal("5.00"), component.getAmount());
        assertEquals(YearMonth.of(2024, 1), component.getPeriod());

        assertThrows(IllegalArgumentException.class,
            () -> PayComponent.create("E001", PayComponentType.DEDUCTION, BigDecimal.ZERO, date, null));
        assertThrows(IllegalArgumentException.class,
            () -> PayComponent.create("E001", null, BigDecimal.TEN, date, null));
    }
}
