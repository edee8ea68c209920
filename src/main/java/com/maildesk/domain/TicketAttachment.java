package com.maildesk.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stored attachment reference
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketAttachment {

    private Long id;
    private String ticketId;
    private String messageUid;
    private String originalFilename;
    private String storedPath;          // Relative to the attachment root
    private String contentType;
    private long size;
    private String kind;                // FILE | BODY
}
