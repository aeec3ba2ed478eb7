package com.flagship.payroll_ledger.notification;

public class JournalNotificationException extends RuntimeException {

    public JournalNotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
