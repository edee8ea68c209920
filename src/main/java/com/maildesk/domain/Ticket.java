package com.maildesk.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Support ticket entity (one row per conversation)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Ticket {

    private String ticketId;            // TKT-<uuid>, stable for the conversation
    private String createdAt;
    private String updatedAt;
    private String requesterEmail;
    private String requesterName;
    private String membershipRef;       // FFNUM when known
    private String memberTier;
    private String subject;
    private String body;                // Body of the first message
    private String category;
    private String status;
    private String deliveryStatus;      // NORMAL | UNDELIVERED
    private int messageCount;
}
