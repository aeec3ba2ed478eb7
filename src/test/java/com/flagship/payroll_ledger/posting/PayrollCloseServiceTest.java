package com.flagship.payroll_ledger.posting;

import com.flagship.payroll_ledger.ledger.EntryType;
import com.flagship.payroll_ledger.ledger.Journal;
import com.flagship.payroll_ledger.ledger.JournalEntry;
import com.flagship.payroll_ledger.ledger.JournalEntryRequest;
import com.flagship.payroll_ledger.ledger.JournalFactory;
import com.flagship.payroll_ledger.ledger.JournalRequest;
import com.flagship.payroll_ledger.ledger.JournalStatus;
import com.flagship.payroll_ledger.ledger.LedgerStore;
import com.flagship.payroll_ledger.ledger.SourceKind;
import com.flagship.payroll_ledger.ledger.SourceReference;
import com.flagship.payroll_ledger.ledger.exception.DuplicatePostingException;
import com.flagship.payroll_ledger.ledger.exception.InsufficientBalanceException;
import com.flagship.payroll_ledger.notification.JournalNotifier;
import com.flagship.payroll_ledger.notification.JournalPostedNotification;
import com.flagship.payroll_ledger.observability.LedgerMetrics;
import com.flagship.payroll_ledger.payroll.PayrollRun;
import com.flagship.payroll_ledger.payroll.PayrollRunEntity;
import com.flagship.payroll_ledger.payroll.PayrollRunLine;
import com.flagship.payroll_ledger.payroll.PayrollRunPersistenceService;
import com.flagship.payroll_ledger.payroll.PayrollRunSnapshot;
import com.flagship.payroll_ledger.payroll.PayrollRunStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Close orchestration with the ledger and persistence mocked out.
 * PayrollCloseIntegrationTest runs the same flows against Postgres.
 */
class PayrollCloseServiceTest {

    private PayrollRunPersistenceService persistenceService;
    private JournalFactory journalFactory;
    private LedgerStore ledgerStore;
    private JournalNotifier journalNotifier;
    private PlatformTransactionManager transactionManager;
    private SimpleMeterRegistry meterRegistry;
    private PayrollCloseService closeService;

    private PayrollRun openRun;
    private PayrollRunEntity runEntity;
    private SourceReference source;

    @BeforeEach
    void setUp() {
        persistenceService = mock(PayrollRunPersistenceService.class);
        journalFactory = mock(JournalFactory.class);
        ledgerStore = mock(LedgerStore.class);
        journalNotifier = mock(JournalNotifier.class);
        transactionManager = mock(PlatformTransactionManager.class);
        meterRegistry = new SimpleMeterRegistry();
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());

        closeService = new PayrollCloseService(
            persistenceService,
            new PostingRuleEngine(PayrollPostingSettings.defaults()),
            journalFactory,
            ledgerStore,
            journalNotifier,
            new LedgerMetrics(meterRegistry),
            new TransactionTemplate(transactionManager)
        );

        openRun = PayrollRun.create(UUID.randomUUID(), "March 2024", YearMonth.of(2024, 3));
        source = SourceReference.payrollRun(openRun.getId());
        runEntity = mockEntity(openRun);
        when(persistenceService.findByIdForUpdate(openRun.getId())).thenReturn(Optional.of(runEntity));
    }

    private static PayrollRunEntity mockEntity(PayrollRun run) {
        PayrollRunEntity entity = mock(PayrollRunEntity.class);
        when(entity.toDomain()).thenReturn(run);
        return entity;
    }

    private void givenLines(PayrollRunLine... lines) {
        when(persistenceService.loadSnapshot(any(PayrollRun.class))).thenAnswer(invocation ->
            new PayrollRunSnapshot(invocation.getArgument(0), List.of(lines), List.of()));
    }

    private PayrollRunLine line(String employeeId, String netPay) {
        return PayrollRunLine.create(openRun.getId(), employeeId, null, new BigDecimal(netPay),
            null, null, null, null);
    }

    private Journal postedJournal(String amount) {
        UUID journalId = UUID.randomUUID();
        BigDecimal value = new BigDecimal(amount);
        return new Journal(journalId, "TXN000007", JournalStatus.POSTED, "Payroll run", openRun.getPeriodEnd(),
            source, Instant.now(), Instant.now(), List.of(
                new JournalEntry(UUID.randomUUID(), journalId, UUID.randomUUID(), "6010", EntryType.DEBIT, value, null, 1),
                new JournalEntry(UUID.randomUUID(), journalId, UUID.randomUUID(), "1100", EntryType.CREDIT, value, null, 2)
            ));
    }

    private List<PayrollRun> capturedUpdates(int expected) {
        ArgumentCaptor<PayrollRun> captor = ArgumentCaptor.forClass(PayrollRun.class);
        verify(persistenceService, times(expected)).update(eq(runEntity), captor.capture());
        return captor.getAllValues();
    }

    @Test
    @DisplayName("Closing an OPEN run posts one journal, closes the run and notifies")
    void testCloseOpenRun_PostsJournal() {
        givenLines(line("E001", "50000.00"));
        Journal journal = postedJournal("50000.00");
        when(journalFactory.createJournal(any(JournalRequest.class))).thenReturn(journal);

        CloseResult result = closeService.closeRun(openRun.getId());

        assertEquals(CloseResult.Outcome.POSTED, result.getOutcome());
        assertEquals(journal.getId(), result.getJournalId());

        ArgumentCaptor<JournalRequest> request = ArgumentCaptor.forClass(JournalRequest.class);
        verify(journalFactory).createJournal(request.capture());
        assertTrue(request.getValue().isAutoPost());
        assertEquals(source, request.getValue().getSourceReference());
        assertEquals(openRun.getPeriodEnd(), request.getValue().getDate());
        assertEquals(List.of(
            JournalEntryRequest.debit("6010", new BigDecimal("50000.00"), "Salary expense - E001"),
            JournalEntryRequest.credit("1100", new BigDecimal("50000.00"), "Net pay - E001")
        ), request.getValue().getEntries());

        List<PayrollRun> updates = capturedUpdates(2);
        assertEquals(PayrollRunStatus.CLOSING, updates.get(0).getStatus());
        assertEquals(PayrollRunStatus.CLOSED, updates.get(1).getStatus());
        assertEquals(journal.getId(), updates.get(1).getJournalId());

        ArgumentCaptor<JournalPostedNotification> notification = ArgumentCaptor.forClass(JournalPostedNotification.class);
        verify(journalNotifier).journalPosted(notification.capture());
        assertEquals("PAYROLL_RUN", notification.getValue().getEventKind());
        assertEquals(openRun.getId(), notification.getValue().getEventId());
        assertEquals(journal.getId(), notification.getValue().getJournalId());
        assertEquals("TXN000007", notification.getValue().getTransactionNumber());
        assertEquals(new BigDecimal("50000.00"), notification.getValue().getTotalAmount());

        verify(transactionManager).commit(any());
        assertEquals(1.0, meterRegistry.counter("payroll.close", "outcome", "posted").count());
    }

    @Test
    @DisplayName("Closing a CLOSED run returns its journal without posting or notifying")
    void testCloseClosedRun_ReturnsExistingJournal() {
        Journal journal = postedJournal("100.00");
        PayrollRun closed = openRun.startClosing().close(journal.getId());
        PayrollRunEntity closedEntity = mockEntity(closed);
        when(persistenceService.findByIdForUpdate(openRun.getId())).thenReturn(Optional.of(closedEntity));
        when(ledgerStore.findJournal(journal.getId())).thenReturn(Optional.of(journal));

        CloseResult result = closeService.closeRun(openRun.getId());

        assertEquals(CloseResult.Outcome.ALREADY_CLOSED, result.getOutcome());
        assertEquals(journal.getId(), result.getJournalId());
        verify(journalFactory, never()).createJournal(any());
        verify(persistenceService, never()).update(any(), any());
        verify(journalNotifier, never()).journalPosted(any());
    }

    @Test
    @DisplayName("A journal already posted for the run marks it CLOSED without posting again")
    void testExistingJournalForSource_MarksClosed() {
        Journal journal = postedJournal("100.00");
        when(ledgerStore.findJournalBySource(source)).thenReturn(Optional.of(journal));

        CloseResult result = closeService.closeRun(openRun.getId());

        assertEquals(CloseResult.Outcome.ALREADY_CLOSED, result.getOutcome());
        assertEquals(journal.getId(), result.getJournalId());
        verify(journalFactory, never()).createJournal(any());
        List<PayrollRun> updates = capturedUpdates(1);
        assertEquals(PayrollRunStatus.CLOSED, updates.get(0).getStatus());
        assertEquals(journal.getId(), updates.get(0).getJournalId());
    }

    @Test
    @DisplayName("A run with nothing to post closes without a journal")
    void testEmptyRun_ClosesWithoutJournal() {
        givenLines();

        CloseResult result = closeService.closeRun(openRun.getId());

        assertEquals(CloseResult.Outcome.NO_JOURNAL, result.getOutcome());
        assertFalse(result.hasJournal());
        verify(journalFactory, never()).createJournal(any());
        verify(journalNotifier, never()).journalPosted(any());
        List<PayrollRun> updates = capturedUpdates(2);
        assertEquals(PayrollRunStatus.CLOSED, updates.get(1).getStatus());
        assertNull(updates.get(1).getJournalId());
    }

    @Test
    @DisplayName("Posting failure rolls back and propagates unchanged")
    void testPostingFailure_RollsBack() {
        givenLines(line("E001", "50000.00"));
        InsufficientBalanceException failure = new InsufficientBalanceException(
            "1100", BigDecimal.ZERO, new BigDecimal("50000.00"), openRun.getPeriodEnd());
        when(journalFactory.createJournal(any(JournalRequest.class))).thenThrow(failure);

        InsufficientBalanceException thrown = assertThrows(InsufficientBalanceException.class,
            () -> closeService.closeRun(openRun.getId()));

        assertSame(failure, thrown);
        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
        verify(journalNotifier, never()).journalPosted(any());
        assertEquals(1.0, meterRegistry.counter("payroll.close", "outcome", "error").count());
    }

    @Test
    @DisplayName("A concurrent winner's journal is returned as ALREADY_CLOSED")
    void testDuplicatePosting_ResolvedToExistingJournal() {
        givenLines(line("E001", "50000.00"));
        Journal journal = postedJournal("50000.00");
        PayrollRunEntity closedEntity = mockEntity(openRun.startClosing().close(journal.getId()));
        when(persistenceService.findByIdForUpdate(openRun.getId()))
            .thenReturn(Optional.of(runEntity), Optional.of(closedEntity));
        when(journalFactory.createJournal(any(JournalRequest.class)))
            .thenThrow(new DuplicatePostingException(source, null));
        when(ledgerStore.findJournal(journal.getId())).thenReturn(Optional.of(journal));

        CloseResult result = closeService.closeRun(openRun.getId());

        assertEquals(CloseResult.Outcome.ALREADY_CLOSED, result.getOutcome());
        assertEquals(journal.getId(), result.getJournalId());
        verify(transactionManager).rollback(any());
        verify(journalNotifier, never()).journalPosted(any());
    }

    @Test
    @DisplayName("Notifier failure is logged and counted but the close still succeeds")
    void testNotifierFailure_DoesNotFailClose() {
        givenLines(line("E001", "10.00"));
        Journal journal = postedJournal("10.00");
        when(journalFactory.createJournal(any(JournalRequest.class))).thenReturn(journal);
        doThrow(new IllegalStateException("broker down")).when(journalNotifier).journalPosted(any());

        CloseResult result = closeService.closeRun(openRun.getId());

        assertEquals(CloseResult.Outcome.POSTED, result.getOutcome());
        verify(transactionManager).commit(any());
        assertEquals(1.0, meterRegistry.counter("ledger.notifications",
            "event_kind", SourceKind.PAYROLL_RUN.name(), "result", "failed").count());
    }

    @Test
    @DisplayName("Unknown run is rejected")
    void testUnknownRun_ShouldFail() {
        UUID unknown = UUID.randomUUID();
        when(persistenceService.findByIdForUpdate(unknown)).thenReturn(Optional.empty());

        assertThrows(IllegalArgumentException.class, () -> closeService.closeRun(unknown));
    }
}
