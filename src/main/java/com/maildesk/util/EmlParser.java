package com.maildesk.util;

import jakarta.mail.Address;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeUtility;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.time.Instant;
import java.util.Date;
import java.util.Properties;

/**
 * EML parsing utilities based on Jakarta Mail
 */
@Slf4j
public final class EmlParser {

    private static final Session SESSION;

    static {
        Properties props = new Properties();
        props.setProperty("mail.mime.charset", "UTF-8");
        props.setProperty("mail.mime.decodetext.strict", "false");
        props.setProperty("mail.mime.address.strict", "false");
        props.setProperty("mail.mime.decodefilename", "true");
        SESSION = Session.getInstance(props);
    }

    private EmlParser() {}

    /**
     * Parse a MimeMessage from bytes
     */
    public static MimeMessage parse(byte[] emlData) throws Exception {
        try (InputStream is = new ByteArrayInputStream(emlData)) {
            return new MimeMessage(SESSION, is);
        }
    }

    /**
     * Extract Message-ID, null when absent or unreadable
     */
    public static String extractMessageId(MimeMessage message) {
        try {
            return message.getMessageID();
        } catch (Exception e) {
            log.debug("Unreadable Message-ID header: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Extract decoded Subject, empty when absent or unreadable
     */
    public static String extractSubject(MimeMessage message) {
        try {
            String subject = message.getSubject();
            return subject != null ? subject : "";
        } catch (Exception e) {
            log.debug("Unreadable Subject header: {}", e.getMessage());
            return decodeText(firstHeader(message, "Subject"));
        }
    }

    /**
     * Extract the bare sender address (lower-cased), empty when absent
     */
    public static String extractSenderAddress(MimeMessage message) {
        InternetAddress from = firstFrom(message);
        if (from != null && from.getAddress() != null) {
            return CryptoUtil.stripAngleBrackets(from.getAddress()).toLowerCase();
        }
        return "";
    }

    /**
     * Extract the sender display name, empty when absent
     */
    public static String extractSenderName(MimeMessage message) {
        InternetAddress from = firstFrom(message);
        if (from != null && from.getPersonal() != null) {
            return from.getPersonal().trim();
        }
        return "";
    }

    /**
     * Extract the Date header, null when absent or unparseable
     */
    public static Instant extractSentDate(MimeMessage message) {
        try {
            Date sent = message.getSentDate();
            return sent != null ? sent.toInstant() : null;
        } catch (Exception e) {
            log.debug("Unreadable Date header: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Decode RFC 2047 encoded words; returns the input unchanged when it cannot be decoded
     */
    public static String decodeText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        try {
            return MimeUtility.decodeText(text);
        } catch (Exception e) {
            return text;
        }
    }

    private static InternetAddress firstFrom(MimeMessage message) {
        try {
            Address[] from = message.getFrom();
            if (from != null && from.length > 0 && from[0] instanceof InternetAddress address) {
                return address;
            }
        } catch (Exception e) {
            // Lenient fallback on the raw header
            String raw = firstHeader(message, "From");
            if (!raw.isEmpty()) {
                try {
                    InternetAddress[] parsed = InternetAddress.parseHeader(raw, false);
                    if (parsed.length > 0) {
                        return parsed[0];
                    }
                } catch (Exception inner) {
                    log.debug("Unparseable From header: {}", raw);
                }
            }
        }
        return null;
    }

    private static String firstHeader(MimeMessage message, String name) {
        try {
            String[] values = message.getHeader(name);
            return values != null && values.length > 0 ? values[0] : "";
        } catch (Exception e) {
            return "";
        }
    }
}
