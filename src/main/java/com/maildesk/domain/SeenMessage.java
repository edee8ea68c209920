package com.maildesk.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Processed message marker
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeenMessage {

    private String messageUid;
    private String seenAt;
}
