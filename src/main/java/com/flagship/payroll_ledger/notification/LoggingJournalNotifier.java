package com.flagship.payroll_ledger.notification;

import com.flagship.payroll_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes notifications to the log. Used when Kafka notifications are disabled.
 */
@Slf4j
@RequiredArgsConstructor
public class LoggingJournalNotifier implements JournalNotifier {

    private final LedgerMetrics ledgerMetrics;

    @Override
    public void journalPosted(JournalPostedNotification notification) {
        log.info("Journal posted: eventKind={}, eventId={}, journalId={}, transactionNumber={}, amount={}",
                notification.getEventKind(),
                notification.getEventId(),
                notification.getJournalId(),
                notification.getTransactionNumber(),
                notification.getTotalAmount());
        ledgerMetrics.recordNotificationSent(notification.getEventKind());
    }
}
