package com.maildesk.fetch;

import com.maildesk.exception.MailConnectionLostException;
import com.maildesk.exception.MailTransportException;
import com.maildesk.util.CryptoUtil;
import jakarta.mail.FolderClosedException;
import jakarta.mail.StoreClosedException;

/**
 * Unique id handling shared by candidate implementations.
 * Servers without UIDL/UID support get a content hash as the unique id.
 */
public abstract class AbstractCandidateMessage implements CandidateMessage {

    public static final String HASH_ID_PREFIX = "sha256:";

    private final String serverUid;
    private String contentUid;

    protected AbstractCandidateMessage(String serverUid) {
        this.serverUid = serverUid == null || serverUid.isBlank() ? null : serverUid.trim();
    }

    @Override
    public String uniqueId() {
        if (serverUid != null) {
            return serverUid;
        }
        if (contentUid == null) {
            contentUid = HASH_ID_PREFIX + CryptoUtil.sha256(raw());
        }
        return contentUid;
    }

    @Override
    public byte[] raw() {
        try {
            return loadRaw();
        } catch (MailTransportException e) {
            throw e;
        } catch (Exception e) {
            throw wrap("Cannot retrieve message " + number(), e);
        }
    }

    @Override
    public byte[] headers() {
        try {
            return loadHeaders();
        } catch (MailTransportException e) {
            throw e;
        } catch (Exception e) {
            throw wrap("Cannot retrieve headers of message " + number(), e);
        }
    }

    private static MailTransportException wrap(String message, Exception e) {
        if (e instanceof FolderClosedException || e instanceof StoreClosedException) {
            return new MailConnectionLostException(message, e);
        }
        return new MailTransportException(message, e);
    }

    protected abstract byte[] loadRaw() throws Exception;

    protected abstract byte[] loadHeaders() throws Exception;
}
