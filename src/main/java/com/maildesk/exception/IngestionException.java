package com.maildesk.exception;

/**
 * Base type for failures raised while ingesting mail into tickets
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message) {
        super(message);
    }

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
