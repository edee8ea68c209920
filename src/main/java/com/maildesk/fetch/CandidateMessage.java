package com.maildesk.fetch;

/**
 * A message observed on the server.
 * All methods may raise {@link com.maildesk.exception.MailTransportException}.
 */
public interface CandidateMessage {

    /**
     * Position in the mailbox, 1-based
     */
    int number();

    /**
     * Server-assigned unique id, stable across polls
     */
    String uniqueId();

    /**
     * Full message bytes
     */
    byte[] raw();

    /**
     * Header block only, where the server supports fetching it separately
     */
    byte[] headers();

    void markForDeletion();
}
