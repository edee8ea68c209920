package com.maildesk.extract;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Structured ticket fields parsed from one raw message.
 * Fields that could not be decoded are empty rather than missing.
 */
@Data
@Builder
public class ExtractedMessage {

    @Builder.Default
    private String sender = "";         // Bare address, lower-case
    @Builder.Default
    private String senderName = "";
    @Builder.Default
    private String subject = "";
    private String messageId;
    private Instant sentDate;
    @Builder.Default
    private String body = "";
    private boolean bodyHtml;
    @Builder.Default
    private List<ExtractedAttachment> attachments = new ArrayList<>();
    private String membershipRef;
    private boolean undelivered;
    private String undeliveredReason;
}
