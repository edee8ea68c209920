package com.maildesk.fetch;

/**
 * Source of candidate messages from the mail server
 */
public interface MessageFetcher {

    /**
     * Connect and list the mailbox.
     *
     * @param writable open the folder for deletions
     * @throws com.maildesk.exception.MailTransportException when the server cannot be reached
     */
    FetchSession open(boolean writable);
}
