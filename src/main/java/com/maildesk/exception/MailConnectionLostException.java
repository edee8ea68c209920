package com.maildesk.exception;

/**
 * The mailbox connection dropped while a cycle was running; the rest of the cycle is abandoned
 */
public class MailConnectionLostException extends MailTransportException {

    public MailConnectionLostException(String message, Throwable cause) {
        super(message, cause);
    }
}
