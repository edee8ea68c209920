package com.maildesk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * MailDesk configuration properties
 */
@Data
@Component
@ConfigurationProperties(prefix = "maildesk")
public class MailDeskProperties {

    private Mail mail = new Mail();
    private Poll poll = new Poll();
    private State state = new State();
    private Storage storage = new Storage();
    private Ticket ticket = new Ticket();

    @Data
    public static class Mail {
        private String protocol = "pop3s";   // pop3, pop3s, imap, imaps
        private String host = "localhost";
        private int port = 995;
        private String username = "";
        private String password = "";
        private String folder = "INBOX";
        private long connectTimeoutMs = 10000L;
        private long readTimeoutMs = 30000L;
        private long writeTimeoutMs = 20000L;
        private boolean deleteAfterSeal = false;

        public boolean isImap() {
            return protocol != null && protocol.toLowerCase().startsWith("imap");
        }

        public boolean isSsl() {
            return protocol != null && protocol.toLowerCase().endsWith("s");
        }
    }

    @Data
    public static class Poll {
        private String mode = "scheduled";  // scheduled | once
        private long intervalMs = 60000L;
        private long initialDelayMs = 5000L;

        public boolean isRunOnce() {
            return "once".equalsIgnoreCase(mode);
        }
    }

    @Data
    public static class State {
        private String backend = "database";   // database | file
        private String directory = "data";
        private String seenFile = "seen_uidls.json";
        private String identityFile = "ticket_identities.json";
        private String lockFile = "maildesk.lock";
    }

    @Data
    public static class Storage {
        private String attachmentPath = "data/attachments";
        private int maxFilenameLength = 150;
    }

    @Data
    public static class Ticket {
        private String category = "General";
        private String initialStatus = "N";
        private boolean renderBodyHtml = true;

        /**
         * First capture group is taken as the membership reference.
         */
        private String membershipPattern =
                "(?i)\\b(?:ffnum|member(?:ship)?\\s*(?:no\\.?|number|#|id))\\s*[:#]?\\s*([A-Z0-9]{5,20})\\b";
    }
}
