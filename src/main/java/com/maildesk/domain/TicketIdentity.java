package com.maildesk.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Conversation key to ticket id mapping
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketIdentity {

    private String conversationKey;
    private String ticketId;
    private String createdAt;
}
