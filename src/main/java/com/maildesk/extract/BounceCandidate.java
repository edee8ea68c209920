package com.maildesk.extract;

import java.util.List;

/**
 * The parts of a message bounce rules look at
 */
public record BounceCandidate(String sender, String subject, String contentType, List<String> textParts) {
}
