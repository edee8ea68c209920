package com.maildesk.extract;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * RFC 3464 delivery status notification (multipart/report)
 */
@Component
@Order(3)
public class DeliveryReportBounceRule implements BounceRule {

    @Override
    public boolean matches(BounceCandidate candidate) {
        String contentType = candidate.contentType();
        return contentType != null && contentType.toLowerCase().startsWith("multipart/report");
    }

    @Override
    public String reason() {
        return "Delivery status report";
    }
}
