package com.maildesk.service;

import com.maildesk.exception.MailConnectionLostException;
import com.maildesk.extract.ExtractedMessage;
import com.maildesk.extract.TicketExtractor;
import com.maildesk.fetch.CandidateMessage;
import com.maildesk.fetch.FetchSession;
import com.maildesk.fetch.MessageFetcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Bulk deletion of server messages by criteria
 * - Header-only inspection unless the bounce filter needs the body
 * - Deletions commit when the mailbox session closes
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MailboxPurgeService {

    private final MessageFetcher fetcher;
    private final TicketExtractor extractor;

    public PurgeReport purge(PurgeCriteria criteria) {
        Pattern subjectPattern = criteria.subjectRegex() == null || criteria.subjectRegex().isBlank()
                ? null
                : Pattern.compile(criteria.subjectRegex(), Pattern.CASE_INSENSITIVE);

        PurgeReport report = new PurgeReport();
        report.setDryRun(criteria.dryRun());

        FetchSession session = fetcher.open(!criteria.dryRun());
        try {
            for (CandidateMessage candidate : session.candidates()) {
                report.setChecked(report.getChecked() + 1);
                try {
                    ExtractedMessage message = extractor.extract(contentFor(candidate, criteria));
                    if (!matches(message, criteria, subjectPattern)) {
                        continue;
                    }
                    report.setMatched(report.getMatched() + 1);
                    if (!criteria.dryRun()) {
                        candidate.markForDeletion();
                        report.setDeleted(report.getDeleted() + 1);
                    }
                } catch (MailConnectionLostException e) {
                    report.getErrors().add("#" + candidate.number() + ": " + e.getMessage());
                    break;
                } catch (RuntimeException e) {
                    report.getErrors().add("#" + candidate.number() + ": " + e.getMessage());
                }
            }
        } finally {
            session.close();
        }

        log.info("Mailbox purge{}: checked={}, matched={}, deleted={}, errors={}",
                criteria.dryRun() ? " (dry run)" : "", report.getChecked(), report.getMatched(),
                report.getDeleted(), report.getErrors().size());
        return report;
    }

    boolean matches(ExtractedMessage message, PurgeCriteria criteria, Pattern subjectPattern) {
        if (criteria.before() != null) {
            if (message.getSentDate() == null || !message.getSentDate().isBefore(criteria.before())) {
                return false;
            }
        }
        if (criteria.fromContains() != null && !criteria.fromContains().isBlank()) {
            String needle = criteria.fromContains().toLowerCase(Locale.ROOT);
            if (!message.getSender().toLowerCase(Locale.ROOT).contains(needle)) {
                return false;
            }
        }
        if (subjectPattern != null && !subjectPattern.matcher(message.getSubject()).find()) {
            return false;
        }
        if (criteria.undeliveredOnly() != null && criteria.undeliveredOnly() != message.isUndelivered()) {
            return false;
        }
        return true;
    }

    private static byte[] contentFor(CandidateMessage candidate, PurgeCriteria criteria) {
        if (criteria.undeliveredOnly() != null) {
            return candidate.raw();
        }
        try {
            byte[] headers = candidate.headers();
            if (headers != null && headers.length > 2) {
                return headers;
            }
        } catch (MailConnectionLostException e) {
            throw e;
        } catch (RuntimeException e) {
            log.debug("Header fetch failed for message {}, using full message: {}", candidate.number(), e.getMessage());
        }
        return candidate.raw();
    }
}
