package com.maildesk.fetch;

import com.maildesk.config.MailDeskProperties;
import com.maildesk.exception.MailTransportException;
import jakarta.mail.FetchProfile;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.UIDFolder;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.angus.mail.pop3.POP3Folder;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.Properties;

/**
 * POP3 / IMAP fetcher on Jakarta Mail
 * - POP3 unique ids from UIDL
 * - IMAP unique ids as UIDVALIDITY:UID
 * - Bounded connect/read/write timeouts
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JakartaMailFetcher implements MessageFetcher {

    private final MailDeskProperties properties;

    @Override
    public FetchSession open(boolean writable) {
        MailDeskProperties.Mail mail = properties.getMail();
        String protocol = mail.getProtocol().toLowerCase();

        Store store = null;
        try {
            Session session = Session.getInstance(sessionProperties(mail, protocol));
            store = session.getStore(protocol);
            store.connect(mail.getHost(), mail.getPort(), mail.getUsername(), mail.getPassword());

            Folder folder = store.getFolder(mail.getFolder());
            folder.open(writable ? Folder.READ_WRITE : Folder.READ_ONLY);

            Message[] messages = folder.getMessages();
            FetchProfile profile = new FetchProfile();
            profile.add(UIDFolder.FetchProfileItem.UID);
            folder.fetch(messages, profile);

            log.info("Connected to {}://{}:{}/{} ({} messages)",
                    protocol, mail.getHost(), mail.getPort(), mail.getFolder(), messages.length);
            return new JakartaMailSession(store, folder, messages, writable);
        } catch (MessagingException e) {
            closeQuietly(store);
            throw new MailTransportException("Cannot open mailbox " + mail.getHost() + ":" + mail.getPort(), e);
        }
    }

    Properties sessionProperties(MailDeskProperties.Mail mail, String protocol) {
        Properties props = new Properties();
        String prefix = "mail." + protocol + ".";
        props.put("mail.store.protocol", protocol);
        props.put(prefix + "host", mail.getHost());
        props.put(prefix + "port", String.valueOf(mail.getPort()));
        props.put(prefix + "connectiontimeout", String.valueOf(mail.getConnectTimeoutMs()));
        props.put(prefix + "timeout", String.valueOf(mail.getReadTimeoutMs()));
        props.put(prefix + "writetimeout", String.valueOf(mail.getWriteTimeoutMs()));
        if (mail.isSsl()) {
            props.put(prefix + "ssl.enable", "true");
        }
        if (!mail.isImap()) {
            // Fetch headers with TOP and keep UIDL for the whole session
            props.put(prefix + "disabletop", "false");
            props.put(prefix + "rsetbeforequit", "false");
        }
        props.put("mail.mime.address.strict", "false");
        return props;
    }

    private static void closeQuietly(Store store) {
        if (store == null) {
            return;
        }
        try {
            store.close();
        } catch (MessagingException e) {
            log.warn("Failed to close mail store: {}", e.getMessage());
        }
    }

    static final class JakartaMailSession implements FetchSession {

        private final Store store;
        private final Folder folder;
        private final List<CandidateMessage> candidates;
        private final boolean writable;

        JakartaMailSession(Store store, Folder folder, Message[] messages, boolean writable) throws MessagingException {
            this.store = store;
            this.folder = folder;
            this.writable = writable;
            List<CandidateMessage> list = new ArrayList<>(messages.length);
            for (Message message : messages) {
                list.add(new JakartaMailCandidate(message, uidOf(folder, message), writable));
            }
            this.candidates = Collections.unmodifiableList(list);
        }

        @Override
        public List<CandidateMessage> candidates() {
            return candidates;
        }

        @Override
        public void close() {
            try {
                if (folder.isOpen()) {
                    folder.close(writable);
                }
            } catch (MessagingException e) {
                throw new MailTransportException("Failed to close mailbox folder", e);
            } finally {
                closeQuietly(store);
            }
        }

        private static String uidOf(Folder folder, Message message) throws MessagingException {
            if (folder instanceof UIDFolder uidFolder) {
                long uid = uidFolder.getUID(message);
                return uid < 0 ? null : uidFolder.getUIDValidity() + ":" + uid;
            }
            if (folder instanceof POP3Folder pop3Folder) {
                return pop3Folder.getUID(message);
            }
            return null;
        }
    }

    static final class JakartaMailCandidate extends AbstractCandidateMessage {

        private final Message message;
        private final boolean writable;

        JakartaMailCandidate(Message message, String serverUid, boolean writable) {
            super(serverUid);
            this.message = message;
            this.writable = writable;
        }

        @Override
        public int number() {
            return message.getMessageNumber();
        }

        @Override
        protected byte[] loadRaw() throws Exception {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            message.writeTo(out);
            return out.toByteArray();
        }

        @Override
        protected byte[] loadHeaders() throws Exception {
            StringBuilder sb = new StringBuilder();
            Enumeration<String> lines = message instanceof MimeMessage mime
                    ? mime.getAllHeaderLines()
                    : Collections.emptyEnumeration();
            while (lines.hasMoreElements()) {
                sb.append(lines.nextElement()).append("\r\n");
            }
            sb.append("\r\n");
            return sb.toString().getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public void markForDeletion() {
            if (!writable) {
                throw new IllegalStateException("Mailbox was opened read-only");
            }
            try {
                message.setFlag(Flags.Flag.DELETED, true);
            } catch (MessagingException e) {
                throw new MailTransportException("Cannot mark message " + number() + " deleted", e);
            }
        }
    }
}
