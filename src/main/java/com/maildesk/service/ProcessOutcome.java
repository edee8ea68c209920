package com.maildesk.service;

/**
 * Terminal state of one candidate message within a cycle
 */
public enum ProcessOutcome {
    CREATED,        // Sealed, new ticket
    FOLLOW_UP,      // Sealed, appended to an existing ticket
    DEDUPLICATED,   // Already seen, nothing done
    RESUMED,        // Persisted by an earlier run that stopped before sealing; sealed now
    FAILED;         // Left unseen for the next cycle

    public boolean isSealed() {
        return this != FAILED;
    }
}
