package com.maildesk.service;

import com.maildesk.config.MailDeskProperties;
import com.maildesk.exception.MailConnectionLostException;
import com.maildesk.extract.BounceDetector;
import com.maildesk.extract.TicketExtractor;
import com.maildesk.fetch.CandidateMessage;
import com.maildesk.fetch.FetchSession;
import com.maildesk.fetch.MessageFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * MailboxPurgeService unit tests
 */
class MailboxPurgeServiceTest {

    private final List<Message> mailbox = new ArrayList<>();
    private boolean openedWritable;
    private boolean closed;
    private MailboxPurgeService purgeService;

    @BeforeEach
    void setUp() {
        MessageFetcher fetcher = writable -> {
            openedWritable = writable;
            return new FetchSession() {
                @Override
                public List<CandidateMessage> candidates() {
                    return List.copyOf(mailbox);
                }

                @Override
                public void close() {
                    closed = true;
                }
            };
        };
        purgeService = new MailboxPurgeService(fetcher,
                new TicketExtractor(BounceDetector.withDefaultRules(), new MailDeskProperties()));

        mailbox.add(new Message(1, "From: alice@example.com\r\nSubject: Old question\r\n"
                + "Date: Mon, 01 Jan 2024 10:00:00 +0000\r\n\r\nbody\r\n"));
        mailbox.add(new Message(2, "From: MAILER-DAEMON@mx.example.com\r\nSubject: Undelivered Mail Returned to Sender\r\n"
                + "Date: Tue, 02 Jan 2024 10:00:00 +0000\r\n\r\nbounce\r\n"));
        mailbox.add(new Message(3, "From: bob@example.com\r\nSubject: New question\r\n"
                + "Date: Sat, 01 Jun 2024 10:00:00 +0000\r\n\r\nbody\r\n"));
    }

    @Test
    @DisplayName("Dry run reports matches without deleting")
    void testDryRun() {
        PurgeReport report = purgeService.purge(
                new PurgeCriteria(Instant.parse("2024-03-01T00:00:00Z"), null, null, null, true));

        assertThat(report.getChecked()).isEqualTo(3);
        assertThat(report.getMatched()).isEqualTo(2);
        assertThat(report.getDeleted()).isZero();
        assertThat(openedWritable).isFalse();
        assertThat(mailbox).noneMatch(m -> m.deleted);
        assertThat(closed).isTrue();
    }

    @Test
    @DisplayName("Matching messages are marked for deletion")
    void testDelete() {
        PurgeReport report = purgeService.purge(new PurgeCriteria(null, "example.com", "question", null, false));

        assertThat(report.getDeleted()).isEqualTo(2);
        assertThat(openedWritable).isTrue();
        assertThat(mailbox.get(0).deleted).isTrue();
        assertThat(mailbox.get(1).deleted).isFalse();
        assertThat(mailbox.get(2).deleted).isTrue();
    }

    @Test
    @DisplayName("Bounce filter reads the full message")
    void testUndeliveredOnly() {
        PurgeReport report = purgeService.purge(new PurgeCriteria(null, null, null, true, false));

        assertThat(report.getMatched()).isEqualTo(1);
        assertThat(mailbox.get(1).deleted).isTrue();
        assertThat(mailbox.get(1).rawFetched).isTrue();
    }

    @Test
    @DisplayName("Header-only criteria never download bodies")
    void testHeadersOnly() {
        purgeService.purge(new PurgeCriteria(null, "bob", null, null, true));

        assertThat(mailbox).noneMatch(m -> m.rawFetched);
    }

    @Test
    @DisplayName("Lost connection stops the purge and is reported")
    void testConnectionLost() {
        mailbox.get(1).lost = true;

        PurgeReport report = purgeService.purge(new PurgeCriteria(null, "alice", null, null, false));

        assertThat(report.getChecked()).isEqualTo(2);
        assertThat(report.getErrors()).hasSize(1);
        assertThat(mailbox.get(0).deleted).isTrue();
        assertThat(closed).isTrue();
    }

    static class Message implements CandidateMessage {

        private final int number;
        private final String eml;
        private boolean deleted;
        private boolean rawFetched;
        private boolean lost;

        Message(int number, String eml) {
            this.number = number;
            this.eml = eml;
        }

        @Override
        public int number() {
            return number;
        }

        @Override
        public String uniqueId() {
            return "u-" + number;
        }

        @Override
        public byte[] raw() {
            rawFetched = true;
            return eml.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public byte[] headers() {
            if (lost) {
                throw new MailConnectionLostException("folder closed", null);
            }
            return eml.substring(0, eml.indexOf("\r\n\r\n") + 4).getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public void markForDeletion() {
            deleted = true;
        }
    }
}
