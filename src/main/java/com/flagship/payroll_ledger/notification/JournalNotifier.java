package com.flagship.payroll_ledger.notification;

/**
 * Output sink for "journal posted" notifications.
 *
 * Called after commit and must not wait on the transport. An exception means the
 * notification was never dispatched; delivery failures after dispatch are logged and
 * counted by the implementation. Either way the posting itself is already durable.
 */
public interface JournalNotifier {

    void journalPosted(JournalPostedNotification notification);
}
