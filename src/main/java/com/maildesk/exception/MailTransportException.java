package com.maildesk.exception;

/**
 * Mail server unreachable or the connection broke mid-cycle.
 * Aborts the current poll cycle; the next scheduled poll is the retry.
 */
public class MailTransportException extends IngestionException {

    public MailTransportException(String message) {
        super(message);
    }

    public MailTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
