package com.maildesk.extract;

/**
 * Non-body part of a message
 *
 * @param filename    decoded original filename, null when the part carried none
 * @param contentType base content type, e.g. application/pdf
 */
public record ExtractedAttachment(String filename, String contentType, byte[] data) {
}
