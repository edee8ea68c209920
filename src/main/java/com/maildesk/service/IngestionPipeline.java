package com.maildesk.service;

import com.maildesk.config.MailDeskProperties;
import com.maildesk.domain.Member;
import com.maildesk.exception.MailConnectionLostException;
import com.maildesk.extract.ConversationKeys;
import com.maildesk.extract.ExtractedAttachment;
import com.maildesk.extract.ExtractedMessage;
import com.maildesk.extract.TicketExtractor;
import com.maildesk.fetch.CandidateMessage;
import com.maildesk.fetch.FetchSession;
import com.maildesk.fetch.MessageFetcher;
import com.maildesk.store.AttachmentKind;
import com.maildesk.store.AttachmentReference;
import com.maildesk.store.AttachmentStore;
import com.maildesk.store.SeenMessageStore;
import com.maildesk.store.TicketIdentityRegistry;
import com.maildesk.store.TicketResolution;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mail-to-ticket ingestion
 * - Seen check, resume of persisted-but-unsealed messages
 * - Extraction, conversation key, ticket id resolution
 * - Attachment files first, then one record transaction, then markSeen
 * - A failing message is rolled back and left unseen; the cycle moves on
 */
@Slf4j
@Service
public class IngestionPipeline {

    static final String BODY_FILENAME = "message.html";

    private final MessageFetcher fetcher;
    private final TicketExtractor extractor;
    private final SeenMessageStore seenStore;
    private final TicketIdentityRegistry identityRegistry;
    private final AttachmentStore attachmentStore;
    private final TicketRecordService recordService;
    private final MembershipService membershipService;
    private final BodyRenderer bodyRenderer;
    private final MailDeskProperties properties;
    private final Map<ProcessOutcome, Counter> outcomeCounters = new EnumMap<>(ProcessOutcome.class);

    public IngestionPipeline(MessageFetcher fetcher,
            TicketExtractor extractor,
            SeenMessageStore seenStore,
            TicketIdentityRegistry identityRegistry,
            AttachmentStore attachmentStore,
            TicketRecordService recordService,
            MembershipService membershipService,
            BodyRenderer bodyRenderer,
            MailDeskProperties properties,
            MeterRegistry meterRegistry) {
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.seenStore = seenStore;
        this.identityRegistry = identityRegistry;
        this.attachmentStore = attachmentStore;
        this.recordService = recordService;
        this.membershipService = membershipService;
        this.bodyRenderer = bodyRenderer;
        this.properties = properties;
        for (ProcessOutcome outcome : ProcessOutcome.values()) {
            outcomeCounters.put(outcome, Counter.builder("maildesk.messages")
                    .description("Messages handled by the ingestion pipeline")
                    .tag("outcome", outcome.name().toLowerCase())
                    .register(meterRegistry));
        }
    }

    /**
     * Run one fetch cycle over every message currently on the server.
     *
     * @throws com.maildesk.exception.MailTransportException when the mailbox cannot be opened
     */
    public PollCycleResult runCycle() {
        boolean deleteAfterSeal = properties.getMail().isDeleteAfterSeal();
        PollCycleResult result = new PollCycleResult();

        FetchSession session = fetcher.open(deleteAfterSeal);
        try {
            List<CandidateMessage> candidates = session.candidates();
            result.setCandidates(candidates.size());
            log.info("Poll cycle started: {} messages on server", candidates.size());

            for (CandidateMessage candidate : candidates) {
                ProcessOutcome outcome;
                try {
                    outcome = process(candidate);
                } catch (MailConnectionLostException e) {
                    log.error("Mailbox connection lost at message {}, abandoning cycle", candidate.number(), e);
                    result.record(ProcessOutcome.FAILED);
                    outcomeCounters.get(ProcessOutcome.FAILED).increment();
                    result.abort(e.getMessage());
                    break;
                } catch (RuntimeException e) {
                    log.error("Failed to process message {}; it stays unseen for the next cycle",
                            candidate.number(), e);
                    outcome = ProcessOutcome.FAILED;
                }
                result.record(outcome);
                outcomeCounters.get(outcome).increment();

                if (deleteAfterSeal && outcome.isSealed()) {
                    try {
                        candidate.markForDeletion();
                    } catch (RuntimeException e) {
                        log.warn("Could not delete message {} on server: {}", candidate.number(), e.getMessage());
                    }
                }
            }
        } finally {
            try {
                session.close();
            } catch (RuntimeException e) {
                log.warn("Mailbox close failed, pending server deletions were not committed: {}", e.getMessage());
            }
        }

        log.info("Poll cycle finished: created={}, followUps={}, deduplicated={}, resumed={}, failed={}",
                result.getCreated(), result.getFollowUps(), result.getDeduplicated(),
                result.getResumed(), result.getFailed());
        return result;
    }

    /**
     * Take one message from Fetched to a terminal state.
     * Exceptions leave the message unseen.
     */
    public ProcessOutcome process(CandidateMessage candidate) {
        String uid = candidate.uniqueId();

        if (seenStore.has(uid)) {
            log.debug("Message {} already seen, skipped", uid);
            return ProcessOutcome.DEDUPLICATED;
        }

        if (recordService.isRecorded(uid)) {
            seenStore.markSeen(uid);
            log.info("Message {} was persisted by an earlier run, sealed now", uid);
            return ProcessOutcome.RESUMED;
        }

        ExtractedMessage extracted = extractor.extract(candidate.raw());
        if (extracted.isUndelivered()) {
            log.warn("Undelivered notification: uid={}, subject={}, reason={}",
                    uid, extracted.getSubject(), extracted.getUndeliveredReason());
        }

        Optional<Member> member = membershipService.resolve(extracted.getMembershipRef(), extracted.getSender());
        String membershipRef = member.map(Member::getFfnum).orElse(extracted.getMembershipRef());

        String conversationKey = extracted.isUndelivered()
                ? ConversationKeys.forUndelivered(uid)
                : ConversationKeys.derive(extracted.getSender(), extracted.getSubject());
        TicketResolution resolution = identityRegistry.resolveOrCreate(conversationKey);
        String ticketId = resolution.ticketId();

        List<AttachmentReference> written = new ArrayList<>();
        boolean created;
        try {
            if (properties.getTicket().isRenderBodyHtml()) {
                String html = bodyRenderer.render(extracted, member, membershipRef);
                written.add(attachmentStore.save(ticketId, uid, BODY_FILENAME, "text/html",
                        html.getBytes(StandardCharsets.UTF_8), AttachmentKind.BODY));
            }
            for (ExtractedAttachment attachment : extracted.getAttachments()) {
                written.add(attachmentStore.save(ticketId, uid, attachment.filename(),
                        attachment.contentType(), attachment.data(), AttachmentKind.FILE));
            }

            created = recordService.upsertTicket(ticketId, TicketFields.builder()
                    .messageUid(uid)
                    .messageId(extracted.getMessageId())
                    .requesterEmail(extracted.getSender())
                    .requesterName(member.map(Member::getDisplayName)
                            .filter(name -> !name.isBlank())
                            .orElse(extracted.getSenderName()))
                    .membershipRef(membershipRef)
                    .memberTier(member.map(Member::getTier).orElse(null))
                    .subject(extracted.getSubject())
                    .body(extracted.getBody())
                    .undelivered(extracted.isUndelivered())
                    .undeliveredReason(extracted.getUndeliveredReason())
                    .attachments(written)
                    .build());
        } catch (RuntimeException e) {
            rollbackFiles(written);
            throw e;
        }

        seenStore.markSeen(uid);
        log.info("Message {} sealed into ticket {} ({})", uid, ticketId, created ? "new" : "follow-up");
        return created ? ProcessOutcome.CREATED : ProcessOutcome.FOLLOW_UP;
    }

    private void rollbackFiles(List<AttachmentReference> written) {
        for (AttachmentReference ref : written) {
            if (!attachmentStore.delete(ref)) {
                log.warn("Orphaned attachment left behind: {}", ref.storedPath());
            }
        }
    }
}
