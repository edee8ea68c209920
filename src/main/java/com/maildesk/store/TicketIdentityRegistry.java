package com.maildesk.store;

import java.util.Optional;

/**
 * Durable mapping from conversation key to ticket id.
 * At most one ticket id is ever assigned to a key.
 */
public interface TicketIdentityRegistry {

    /**
     * Return the ticket id stored for the key, or assign and persist a new one
     */
    TicketResolution resolveOrCreate(String conversationKey);

    Optional<String> find(String conversationKey);

    int size();

    /**
     * Deliberate truncate; follow-ups of existing conversations will open new tickets
     */
    void reset();
}
