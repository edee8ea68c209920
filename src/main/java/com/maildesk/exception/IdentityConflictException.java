package com.maildesk.exception;

/**
 * The identity registry could not settle on a single ticket id for a conversation key
 */
public class IdentityConflictException extends IngestionException {

    public IdentityConflictException(String message) {
        super(message);
    }
}
