package com.maildesk.extract;

import com.maildesk.config.MailDeskProperties;
import com.maildesk.exception.MessageParseException;
import com.maildesk.util.EmlParser;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.internet.ContentType;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses raw messages into ticket fields
 * - HTML body preferred over text/plain
 * - Parts with a filename, and non-text parts, become attachments
 * - Bounce detection delegated to {@link BounceDetector}
 * - Never fails on bad content: undecodable fields are left empty
 */
@Slf4j
@Component
public class TicketExtractor {

    private static final int MAX_DEPTH = 16;

    private final BounceDetector bounceDetector;
    private final Pattern membershipPattern;

    public TicketExtractor(BounceDetector bounceDetector, MailDeskProperties properties) {
        this.bounceDetector = bounceDetector;
        this.membershipPattern = Pattern.compile(properties.getTicket().getMembershipPattern());
    }

    public ExtractedMessage extract(byte[] raw) {
        MimeMessage message;
        try {
            message = EmlParser.parse(raw);
        } catch (Exception e) {
            log.warn("Unparseable message ({} bytes), recording empty ticket fields: {}", raw.length, e.getMessage());
            return ExtractedMessage.builder().build();
        }

        PartCollector collector = new PartCollector();
        walk(message, collector, 0);

        String sender = EmlParser.extractSenderAddress(message);
        String subject = EmlParser.extractSubject(message);
        String body = collector.html != null ? collector.html : (collector.plain != null ? collector.plain : "");

        Optional<String> bounce = bounceDetector.detect(
                new BounceCandidate(sender, subject, contentTypeOf(message), collector.textParts));

        return ExtractedMessage.builder()
                .sender(sender)
                .senderName(EmlParser.extractSenderName(message))
                .subject(subject)
                .messageId(EmlParser.extractMessageId(message))
                .sentDate(EmlParser.extractSentDate(message))
                .body(body)
                .bodyHtml(collector.html != null)
                .attachments(collector.attachments)
                .membershipRef(findMembershipRef(subject, body))
                .undelivered(bounce.isPresent())
                .undeliveredReason(bounce.orElse(null))
                .build();
    }

    String findMembershipRef(String subject, String body) {
        for (String text : new String[]{subject, body}) {
            if (text == null || text.isEmpty()) {
                continue;
            }
            Matcher m = membershipPattern.matcher(text);
            if (m.find() && m.groupCount() >= 1) {
                return m.group(1).toUpperCase(Locale.ROOT);
            }
        }
        return null;
    }

    private void walk(Part part, PartCollector collector, int depth) {
        if (depth > MAX_DEPTH) {
            log.warn("MIME nesting deeper than {}, remaining parts skipped", MAX_DEPTH);
            return;
        }
        String contentType = contentTypeOf(part);

        try {
            if (contentType.startsWith("multipart/")) {
                Object content = part.getContent();
                if (content instanceof Multipart multipart) {
                    for (int i = 0; i < multipart.getCount(); i++) {
                        walk(multipart.getBodyPart(i), collector, depth + 1);
                    }
                    return;
                }
            }
        } catch (Exception e) {
            log.warn("Unreadable multipart section skipped: {}", e.getMessage());
            return;
        }

        String filename = filenameOf(part);
        boolean isText = contentType.startsWith("text/");
        boolean isAttachment = filename != null
                || Part.ATTACHMENT.equalsIgnoreCase(dispositionOf(part))
                || !isText;

        if (isAttachment) {
            try {
                collector.attachments.add(new ExtractedAttachment(filename, contentType, readBytes(part)));
            } catch (MessageParseException e) {
                log.warn("Attachment {} skipped: {}", filename, e.getMessage());
            }
            return;
        }

        try {
            String text = readText(part);
            collector.textParts.add(text);
            if (contentType.startsWith("text/html") && collector.html == null) {
                collector.html = text;
            } else if (contentType.startsWith("text/plain") && collector.plain == null) {
                collector.plain = text;
            }
        } catch (MessageParseException e) {
            log.warn("Text part skipped: {}", e.getMessage());
        }
    }

    private static String readText(Part part) {
        try {
            Object content = part.getContent();
            if (content instanceof String text) {
                return text;
            }
        } catch (Exception e) {
            // Unknown charset or broken transfer encoding: decode the bytes ourselves
            log.debug("Falling back to lenient text decoding: {}", e.getMessage());
        }
        return new String(readBytes(part), charsetOf(part));
    }

    private static byte[] readBytes(Part part) {
        try (InputStream is = part.getInputStream()) {
            return is.readAllBytes();
        } catch (Exception e) {
            throw new MessageParseException("Cannot decode part content", e);
        }
    }

    private static Charset charsetOf(Part part) {
        try {
            String charset = new ContentType(part.getContentType()).getParameter("charset");
            if (charset != null && Charset.isSupported(charset)) {
                return Charset.forName(charset);
            }
        } catch (Exception e) {
            log.debug("Unreadable charset: {}", e.getMessage());
        }
        return StandardCharsets.UTF_8;
    }

    private static String contentTypeOf(Part part) {
        try {
            String raw = part.getContentType();
            if (raw != null) {
                return new ContentType(raw).getBaseType().toLowerCase(Locale.ROOT);
            }
        } catch (Exception e) {
            log.debug("Unreadable content type, assuming text/plain: {}", e.getMessage());
        }
        return "text/plain";
    }

    private static String filenameOf(Part part) {
        try {
            String name = part.getFileName();
            if (name != null && !name.isBlank()) {
                return EmlParser.decodeText(name);
            }
        } catch (Exception e) {
            log.debug("Unreadable filename: {}", e.getMessage());
        }
        return null;
    }

    private static String dispositionOf(Part part) {
        try {
            return part.getDisposition();
        } catch (Exception e) {
            return null;
        }
    }

    private static class PartCollector {
        private String html;
        private String plain;
        private final List<String> textParts = new ArrayList<>();
        private final List<ExtractedAttachment> attachments = new ArrayList<>();
    }
}
