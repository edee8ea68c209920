package com.maildesk.util;

import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * EmlParser unit tests
 */
class EmlParserTest {

    private static MimeMessage parse(String eml) throws Exception {
        return EmlParser.parse(eml.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Extract headers from a plain message")
    void testExtractHeaders() throws Exception {
        MimeMessage message = parse("From: \"Jane Doe\" <Jane.Doe@Example.COM>\r\n"
                + "Subject: Lost baggage\r\n"
                + "Message-ID: <abc@example.com>\r\n"
                + "Date: Mon, 03 Jun 2024 10:15:30 +0000\r\n"
                + "\r\n"
                + "Hello\r\n");

        assertThat(EmlParser.extractSenderAddress(message)).isEqualTo("jane.doe@example.com");
        assertThat(EmlParser.extractSenderName(message)).isEqualTo("Jane Doe");
        assertThat(EmlParser.extractSubject(message)).isEqualTo("Lost baggage");
        assertThat(EmlParser.extractMessageId(message)).isEqualTo("<abc@example.com>");
        assertThat(EmlParser.extractSentDate(message)).isEqualTo(Instant.parse("2024-06-03T10:15:30Z"));
    }

    @Test
    @DisplayName("Missing headers give empty values")
    void testMissingHeaders() throws Exception {
        MimeMessage message = parse("X-Other: 1\r\n\r\nbody\r\n");

        assertThat(EmlParser.extractSenderAddress(message)).isEmpty();
        assertThat(EmlParser.extractSenderName(message)).isEmpty();
        assertThat(EmlParser.extractSubject(message)).isEmpty();
        assertThat(EmlParser.extractMessageId(message)).isNull();
        assertThat(EmlParser.extractSentDate(message)).isNull();
    }

    @Test
    @DisplayName("Encoded-word subject is decoded")
    void testEncodedSubject() throws Exception {
        MimeMessage message = parse("From: a@b.com\r\n"
                + "Subject: =?UTF-8?B?UsOpY2xhbWF0aW9u?=\r\n"
                + "\r\nbody\r\n");

        assertThat(EmlParser.extractSubject(message)).isEqualTo("Réclamation");
    }

    @Test
    @DisplayName("decodeText leaves undecodable input unchanged")
    void testDecodeText() {
        assertThat(EmlParser.decodeText(null)).isEmpty();
        assertThat(EmlParser.decodeText("plain.pdf")).isEqualTo("plain.pdf");
        assertThat(EmlParser.decodeText("=?UTF-8?Q?caf=C3=A9.pdf?=")).isEqualTo("café.pdf");
    }
}
