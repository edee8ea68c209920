package com.maildesk.fetch;

import java.util.List;

/**
 * One connection to the mailbox, valid for a single poll cycle
 */
public interface FetchSession extends AutoCloseable {

    /**
     * Every message the server currently reports, oldest first.
     * Unique ids are available up front; message bytes load on demand.
     */
    List<CandidateMessage> candidates();

    /**
     * Disconnect; deletions requested through {@link CandidateMessage#markForDeletion()} commit here
     */
    @Override
    void close();
}
