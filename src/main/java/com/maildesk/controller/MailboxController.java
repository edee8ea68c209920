package com.maildesk.controller;

import com.maildesk.exception.MailTransportException;
import com.maildesk.poll.PollRunner;
import com.maildesk.service.MailboxPurgeService;
import com.maildesk.service.PollCycleResult;
import com.maildesk.service.PurgeCriteria;
import com.maildesk.service.PurgeReport;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Mailbox operations REST API
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class MailboxController {

    private final PollRunner pollRunner;
    private final MailboxPurgeService purgeService;

    /**
     * Trigger one poll cycle now
     * POST /api/poll
     */
    @PostMapping("/poll")
    public ResponseEntity<Map<String, Object>> poll() {
        PollCycleResult result;
        try {
            result = pollRunner.runCycle();
        } catch (IllegalStateException e) {
            return errorResponse(HttpStatus.CONFLICT, e.getMessage());
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", result.isAborted() ? "error" : "success");
        response.put("result", result);
        return ResponseEntity.status(result.isAborted() ? HttpStatus.BAD_GATEWAY : HttpStatus.OK).body(response);
    }

    /**
     * Delete server messages by criteria; dry run unless dryRun=false is sent
     * POST /api/mailbox/purge
     */
    @PostMapping("/mailbox/purge")
    public ResponseEntity<Map<String, Object>> purge(@RequestBody(required = false) PurgeRequest request) {
        PurgeRequest req = request != null ? request : new PurgeRequest();

        PurgeCriteria criteria;
        try {
            criteria = req.toCriteria();
        } catch (DateTimeParseException | PatternSyntaxException e) {
            return errorResponse(HttpStatus.BAD_REQUEST, "Invalid purge criteria: " + e.getMessage());
        }

        PurgeReport report;
        try {
            report = pollRunner.runExclusive("mailbox purge", () -> purgeService.purge(criteria));
        } catch (IllegalStateException e) {
            return errorResponse(HttpStatus.CONFLICT, e.getMessage());
        } catch (MailTransportException e) {
            log.error("Mailbox purge failed: {}", e.getMessage());
            return errorResponse(HttpStatus.BAD_GATEWAY, "Mailbox unreachable: " + e.getMessage());
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("report", report);
        return ResponseEntity.ok(response);
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }

    /**
     * Purge request body; {@code before} is an ISO-8601 instant
     */
    @Data
    public static class PurgeRequest {
        private String before;
        private String fromContains;
        private String subjectRegex;
        private Boolean undeliveredOnly;
        private boolean dryRun = true;

        PurgeCriteria toCriteria() {
            Instant cutoff = before == null || before.isBlank() ? null : Instant.parse(before.trim());
            if (subjectRegex != null && !subjectRegex.isBlank()) {
                Pattern.compile(subjectRegex);
            }
            return new PurgeCriteria(cutoff, fromContains, subjectRegex, undeliveredOnly, dryRun);
        }
    }
}
