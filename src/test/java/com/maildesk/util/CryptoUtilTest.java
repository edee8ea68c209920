package com.maildesk.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * CryptoUtil unit tests
 */
class CryptoUtilTest {

    @Test
    @DisplayName("SHA-256 of text and of its UTF-8 bytes match")
    void testSha256() {
        String input = "Subject: hello\r\n\r\nbody";
        String hash = CryptoUtil.sha256(input);

        assertThat(hash).hasSize(64); // SHA-256 is 64 hex characters
        assertThat(hash).matches("[0-9a-f]{64}");
        assertThat(CryptoUtil.sha256(input.getBytes(StandardCharsets.UTF_8))).isEqualTo(hash);
        assertThat(CryptoUtil.sha256("other")).isNotEqualTo(hash);
    }

    @Test
    @DisplayName("Known SHA-256 vector")
    void testSha256KnownValue() {
        assertThat(CryptoUtil.sha256(""))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    @DisplayName("Strip angle brackets (<>)")
    void testStripAngleBrackets() {
        assertThat(CryptoUtil.stripAngleBrackets("<user@test.com>")).isEqualTo("user@test.com");
        assertThat(CryptoUtil.stripAngleBrackets("user@test.com")).isEqualTo("user@test.com");
        assertThat(CryptoUtil.stripAngleBrackets(" <user@test.com ")).isEqualTo("user@test.com");
        assertThat(CryptoUtil.stripAngleBrackets(null)).isNull();
    }

    @Test
    @DisplayName("Extract email local-part")
    void testExtractLocalPart() {
        assertThat(CryptoUtil.extractLocalPart("user@example.com")).isEqualTo("user");
        assertThat(CryptoUtil.extractLocalPart("noatsign")).isEqualTo("noatsign");
        assertThat(CryptoUtil.extractLocalPart(null)).isNull();
    }
}
