package com.maildesk.extract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ConversationKeys unit tests
 */
class ConversationKeysTest {

    @Test
    @DisplayName("Reply and forward prefixes are stripped repeatedly")
    void testNormalizeSubjectPrefixes() {
        assertThat(ConversationKeys.normalizeSubject("Re: Help: login broken")).isEqualTo("help: login broken");
        assertThat(ConversationKeys.normalizeSubject("RE: Fwd: re:  Help: login broken")).isEqualTo("help: login broken");
        assertThat(ConversationKeys.normalizeSubject("AW: WG: Anfrage")).isEqualTo("anfrage");
        assertThat(ConversationKeys.normalizeSubject("Re[2]: status")).isEqualTo("status");
        assertThat(ConversationKeys.normalizeSubject("FW (3): status")).isEqualTo("status");
    }

    @Test
    @DisplayName("Words merely starting like a prefix are kept")
    void testNormalizeSubjectKeepsWords() {
        assertThat(ConversationKeys.normalizeSubject("Refund request")).isEqualTo("refund request");
        assertThat(ConversationKeys.normalizeSubject("Svalbard trip")).isEqualTo("svalbard trip");
    }

    @Test
    @DisplayName("Whitespace is collapsed and case folded")
    void testNormalizeSubjectWhitespace() {
        assertThat(ConversationKeys.normalizeSubject("  Lost\t\tBAGGAGE \r\n claim ")).isEqualTo("lost baggage claim");
    }

    @Test
    @DisplayName("Empty subjects share one placeholder")
    void testNormalizeSubjectEmpty() {
        assertThat(ConversationKeys.normalizeSubject(null)).isEqualTo(ConversationKeys.NO_SUBJECT);
        assertThat(ConversationKeys.normalizeSubject("   ")).isEqualTo(ConversationKeys.NO_SUBJECT);
        assertThat(ConversationKeys.normalizeSubject("Re:")).isEqualTo(ConversationKeys.NO_SUBJECT);
    }

    @Test
    @DisplayName("Original and reply from the same sender share a key")
    void testDeriveGroupsReplies() {
        String original = ConversationKeys.derive("Alice@Example.com", "Help: login broken");
        String reply = ConversationKeys.derive("alice@example.com", "Re: Help: login broken");

        assertThat(reply).isEqualTo(original);
        assertThat(original).isEqualTo("alice@example.com|help: login broken");
    }

    @Test
    @DisplayName("Same subject from another sender is another conversation")
    void testDeriveSeparatesSenders() {
        assertThat(ConversationKeys.derive("bob@example.com", "Help"))
                .isNotEqualTo(ConversationKeys.derive("carol@example.com", "Help"));
    }

    @Test
    @DisplayName("Missing sender uses a placeholder")
    void testDeriveUnknownSender() {
        assertThat(ConversationKeys.derive("", "Hi")).isEqualTo(ConversationKeys.UNKNOWN_SENDER + "|hi");
        assertThat(ConversationKeys.derive(null, null))
                .isEqualTo(ConversationKeys.UNKNOWN_SENDER + "|" + ConversationKeys.NO_SUBJECT);
    }

    @Test
    @DisplayName("Each bounce gets a key of its own")
    void testUndeliveredKeyPerMessage() {
        String first = ConversationKeys.forUndelivered("u-1");
        String second = ConversationKeys.forUndelivered("u-2");

        assertThat(first).isNotEqualTo(second);
        assertThat(first).startsWith(ConversationKeys.UNDELIVERED_PREFIX);
        assertThat(first).isNotEqualTo(ConversationKeys.derive("mailer-daemon@mx.example.com", "u-1"));
    }
}
