package com.maildesk.service;

import com.maildesk.config.MailDeskProperties;
import com.maildesk.domain.Ticket;
import com.maildesk.domain.TicketAttachment;
import com.maildesk.domain.TicketEvent;
import com.maildesk.domain.UndeliveredEmail;
import com.maildesk.exception.StorageException;
import com.maildesk.mapper.TicketAttachmentMapper;
import com.maildesk.mapper.TicketEventMapper;
import com.maildesk.mapper.TicketMapper;
import com.maildesk.mapper.UndeliveredEmailMapper;
import com.maildesk.store.AttachmentReference;
import com.maildesk.util.CryptoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Ticket record store
 * - One ticket row per conversation, created once and updated on follow-ups
 * - One event row per ingested message (message_uid is unique)
 * - Attachment references and undelivered log rows
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketRecordService {

    public static final String DELIVERY_NORMAL = "NORMAL";
    public static final String DELIVERY_UNDELIVERED = "UNDELIVERED";

    private static final int MAX_SUBJECT = 1600;
    private static final int MAX_EMAIL = 200;
    private static final int MAX_NAME = 100;

    private final TicketMapper ticketMapper;
    private final TicketEventMapper eventMapper;
    private final TicketAttachmentMapper attachmentMapper;
    private final UndeliveredEmailMapper undeliveredMapper;
    private final MailDeskProperties properties;

    /**
     * Whether a message has already been persisted (possibly without being sealed)
     */
    public boolean isRecorded(String messageUid) {
        try {
            return eventMapper.countByMessageUid(messageUid) > 0;
        } catch (RuntimeException e) {
            throw new StorageException("Cannot check record for " + messageUid, e);
        }
    }

    /**
     * Insert the ticket if it does not exist yet, otherwise register a follow-up.
     * Event, attachment references and undelivered log are written in the same transaction.
     *
     * @return true when the ticket row was created by this call
     */
    @Transactional
    public boolean upsertTicket(String ticketId, TicketFields fields) {
        String now = LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        String deliveryStatus = fields.isUndelivered() ? DELIVERY_UNDELIVERED : DELIVERY_NORMAL;

        try {
            boolean created = ticketMapper.countById(ticketId) == 0;
            if (created) {
                ticketMapper.insert(Ticket.builder()
                        .ticketId(ticketId)
                        .createdAt(now)
                        .updatedAt(now)
                        .requesterEmail(fit(fields.getRequesterEmail(), MAX_EMAIL))
                        .requesterName(fit(requesterName(fields), MAX_NAME))
                        .membershipRef(fields.getMembershipRef())
                        .memberTier(fields.getMemberTier())
                        .subject(fit(fields.getSubject(), MAX_SUBJECT))
                        .body(fields.getBody())
                        .category(properties.getTicket().getCategory())
                        .status(properties.getTicket().getInitialStatus())
                        .deliveryStatus(deliveryStatus)
                        .messageCount(1)
                        .build());
            } else {
                ticketMapper.touchFollowUp(ticketId, now, deliveryStatus);
            }

            eventMapper.insert(TicketEvent.builder()
                    .ticketId(ticketId)
                    .messageUid(fields.getMessageUid())
                    .messageId(fields.getMessageId())
                    .sender(fit(fields.getRequesterEmail(), MAX_EMAIL))
                    .subject(fit(fields.getSubject(), MAX_SUBJECT))
                    .body(fields.getBody())
                    .receivedAt(now)
                    .undelivered(fields.isUndelivered() ? 1 : 0)
                    .build());

            for (AttachmentReference ref : fields.getAttachments()) {
                attachmentMapper.insert(TicketAttachment.builder()
                        .ticketId(ticketId)
                        .messageUid(fields.getMessageUid())
                        .originalFilename(ref.originalFilename())
                        .storedPath(ref.storedPath())
                        .contentType(ref.contentType())
                        .size(ref.size())
                        .kind(ref.kind().name())
                        .build());
            }

            if (fields.isUndelivered()) {
                undeliveredMapper.insert(UndeliveredEmail.builder()
                        .senderEmail(fit(fields.getRequesterEmail(), MAX_EMAIL))
                        .dateReceived(now)
                        .reason(fields.getUndeliveredReason())
                        .messageUid(fields.getMessageUid())
                        .build());
            }

            log.info("Ticket {} {}: message={}, from={}, attachments={}", ticketId,
                    created ? "created" : "updated", fields.getMessageUid(), fields.getRequesterEmail(),
                    fields.getAttachments().size());
            return created;
        } catch (RuntimeException e) {
            throw new StorageException("Failed to persist ticket " + ticketId + " for message " + fields.getMessageUid(), e);
        }
    }

    public Ticket getTicket(String ticketId) {
        return ticketMapper.findById(ticketId);
    }

    public List<TicketEvent> getEvents(String ticketId) {
        return eventMapper.findByTicketId(ticketId);
    }

    public List<TicketAttachment> getAttachments(String ticketId) {
        return attachmentMapper.findByTicketId(ticketId);
    }

    public TicketAttachment getAttachment(long id) {
        return attachmentMapper.findById(id);
    }

    public int countTickets() {
        return ticketMapper.countAll();
    }

    private static String requesterName(TicketFields fields) {
        if (fields.getRequesterName() != null && !fields.getRequesterName().isBlank()) {
            return fields.getRequesterName();
        }
        return CryptoUtil.extractLocalPart(fields.getRequesterEmail());
    }

    private static String fit(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max);
    }
}
