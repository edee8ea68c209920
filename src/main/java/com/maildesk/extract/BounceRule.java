package com.maildesk.extract;

/**
 * One way of recognizing an automated delivery-failure notification
 */
public interface BounceRule {

    boolean matches(BounceCandidate candidate);

    /**
     * Reason recorded with the undelivered ticket
     */
    String reason();
}
