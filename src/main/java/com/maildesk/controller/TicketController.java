package com.maildesk.controller;

import com.maildesk.domain.Ticket;
import com.maildesk.domain.TicketAttachment;
import com.maildesk.exception.StorageException;
import com.maildesk.service.TicketRecordService;
import com.maildesk.store.AttachmentKind;
import com.maildesk.store.AttachmentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ticket lookup REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/tickets")
@RequiredArgsConstructor
public class TicketController {

    private final TicketRecordService recordService;
    private final AttachmentStore attachmentStore;

    /**
     * Get ticket with its events and attachments.
     * Rendered message bodies are listed apart from the sender's attachments.
     * GET /api/tickets/{ticketId}
     */
    @GetMapping("/{ticketId}")
    public ResponseEntity<Map<String, Object>> getTicket(@PathVariable String ticketId) {
        Ticket ticket = recordService.getTicket(ticketId);
        if (ticket == null) {
            return errorResponse(HttpStatus.NOT_FOUND, "Ticket not found: " + ticketId);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("ticket", ticket);
        response.put("events", recordService.getEvents(ticketId));
        Map<Boolean, List<TicketAttachment>> byKind = recordService.getAttachments(ticketId).stream()
                .collect(Collectors.partitioningBy(TicketController::isRenderedBody));
        response.put("attachments", byKind.get(false));
        response.put("renderedBodies", byKind.get(true));
        return ResponseEntity.ok(response);
    }

    /**
     * Download an attachment
     * GET /api/tickets/{ticketId}/attachments/{id}
     */
    @GetMapping("/{ticketId}/attachments/{id}")
    public ResponseEntity<?> getAttachment(@PathVariable String ticketId, @PathVariable long id) {
        TicketAttachment attachment = recordService.getAttachment(id);
        if (attachment == null || !ticketId.equals(attachment.getTicketId())) {
            return errorResponse(HttpStatus.NOT_FOUND, "Attachment not found: " + ticketId + "/" + id);
        }

        byte[] data;
        try {
            data = attachmentStore.read(attachment.getStoredPath());
        } catch (StorageException e) {
            log.error("Attachment {} of ticket {} unreadable: {}", id, ticketId, e.getMessage());
            return errorResponse(HttpStatus.GONE, "Attachment file missing: " + attachment.getStoredPath());
        }

        String filename = attachment.getOriginalFilename() == null || attachment.getOriginalFilename().isBlank()
                ? "attachment"
                : attachment.getOriginalFilename();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(mediaTypeOf(attachment.getContentType()));
        headers.setContentDisposition(ContentDisposition.attachment()
                .filename(filename, StandardCharsets.UTF_8)
                .build());
        return new ResponseEntity<>(data, headers, HttpStatus.OK);
    }

    private static boolean isRenderedBody(TicketAttachment attachment) {
        return AttachmentKind.BODY.name().equals(attachment.getKind());
    }

    private static MediaType mediaTypeOf(String contentType) {
        try {
            return MediaType.parseMediaType(contentType);
        } catch (RuntimeException e) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}
