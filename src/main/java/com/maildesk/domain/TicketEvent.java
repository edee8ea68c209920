package com.maildesk.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One ingested message belonging to a ticket
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketEvent {

    private Long id;
    private String ticketId;
    private String messageUid;          // Server unique id (unique)
    private String messageId;           // RFC 5322 Message-ID
    private String sender;
    private String subject;
    private String body;
    private String receivedAt;
    private int undelivered;
}
