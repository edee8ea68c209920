package com.maildesk.store;

/**
 * Durable set of message unique ids that have been fully processed.
 * Loaded in full at startup; every markSeen is durable before it returns.
 */
public interface SeenMessageStore {

    boolean has(String uniqueId);

    /**
     * No-op for an id that is already present.
     *
     * @throws com.maildesk.exception.StorageException when the id could not be made durable;
     *         the id is then not reported as seen either
     */
    void markSeen(String uniqueId);

    int size();

    /**
     * Deliberate truncate; every message on the server becomes a candidate again
     */
    void reset();
}
