package com.maildesk.store;

/**
 * Handle to attachment bytes written by {@link AttachmentStore}
 *
 * @param storedPath path relative to the attachment root, forward slashes
 */
public record AttachmentReference(String ticketId,
                                  String messageUid,
                                  String storedPath,
                                  String originalFilename,
                                  String contentType,
                                  long size,
                                  AttachmentKind kind) {
}
