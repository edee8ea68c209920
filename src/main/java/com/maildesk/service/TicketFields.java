package com.maildesk.service;

import com.maildesk.store.AttachmentReference;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the record store keeps for one ingested message
 */
@Data
@Builder
public class TicketFields {

    private String messageUid;
    private String messageId;
    private String requesterEmail;
    private String requesterName;
    private String membershipRef;
    private String memberTier;
    private String subject;
    private String body;
    private boolean undelivered;
    private String undeliveredReason;
    @Builder.Default
    private List<AttachmentReference> attachments = new ArrayList<>();
}
