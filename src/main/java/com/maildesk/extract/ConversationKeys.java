package com.maildesk.extract;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversation key derivation.
 * Key = lower(sender address) + "|" + normalized subject. Changing this after
 * deployment splits existing conversations into new tickets.
 * Bounces are keyed per message: one MTA sends them all from the same
 * address and subject, for unrelated failed deliveries.
 */
public final class ConversationKeys {

    private static final Pattern REPLY_PREFIX = Pattern.compile(
            "^\\s*(?:re|fwd?|aw|wg|sv|vs|antw)\\s*(?:\\[\\d+\\]|\\(\\d+\\))?\\s*:\\s*",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    static final String NO_SUBJECT = "(no subject)";
    static final String UNKNOWN_SENDER = "(unknown sender)";
    static final String UNDELIVERED_PREFIX = "(undelivered)|";

    private ConversationKeys() {}

    public static String derive(String senderAddress, String subject) {
        String sender = senderAddress == null || senderAddress.isBlank()
                ? UNKNOWN_SENDER
                : senderAddress.trim().toLowerCase(Locale.ROOT);
        return sender + "|" + normalizeSubject(subject);
    }

    /**
     * Key of a bounce notification, unique to the server message
     */
    public static String forUndelivered(String messageUid) {
        return UNDELIVERED_PREFIX + messageUid;
    }

    /**
     * Strip reply/forward prefixes (repeatedly), collapse whitespace, lower-case
     */
    public static String normalizeSubject(String subject) {
        if (subject == null) {
            return NO_SUBJECT;
        }
        String s = WHITESPACE.matcher(subject).replaceAll(" ").trim();
        Matcher m = REPLY_PREFIX.matcher(s);
        while (m.find()) {
            s = s.substring(m.end());
            m = REPLY_PREFIX.matcher(s);
        }
        s = s.trim().toLowerCase(Locale.ROOT);
        return s.isEmpty() ? NO_SUBJECT : s;
    }
}
