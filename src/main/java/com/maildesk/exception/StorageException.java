package com.maildesk.exception;

/**
 * Attachment, record or state write failed.
 * The affected message stays unseen and is retried on the next cycle.
 */
public class StorageException extends IngestionException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
