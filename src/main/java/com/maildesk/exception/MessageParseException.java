package com.maildesk.exception;

/**
 * A message (or one of its parts) could not be decoded
 */
public class MessageParseException extends IngestionException {

    public MessageParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
