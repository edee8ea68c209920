package com.maildesk.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Bounce / undelivered notification log entry
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UndeliveredEmail {

    private Long id;
    private String senderEmail;
    private String dateReceived;
    private String reason;
    private String messageUid;
}
