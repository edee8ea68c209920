package com.maildesk.controller;

import com.maildesk.poll.PollRunner;
import com.maildesk.store.SeenMessageStore;
import com.maildesk.store.TicketIdentityRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator maintenance of the dedup state
 */
@Slf4j
@RestController
@RequestMapping("/api/state")
@RequiredArgsConstructor
public class StateController {

    static final String CONFIRM_TOKEN = "RESET";

    private final SeenMessageStore seenStore;
    private final TicketIdentityRegistry registry;
    private final PollRunner pollRunner;

    /**
     * Forget every seen message and ticket identity.
     * Messages still on the server will be ingested again as new tickets.
     * POST /api/state/reset?confirm=RESET
     */
    @PostMapping("/reset")
    public ResponseEntity<Map<String, Object>> reset(@RequestParam(required = false) String confirm) {
        if (!CONFIRM_TOKEN.equals(confirm)) {
            return errorResponse(HttpStatus.BAD_REQUEST, "Pass confirm=" + CONFIRM_TOKEN + " to reset the state");
        }
        Map<String, Object> cleared;
        try {
            cleared = pollRunner.runExclusive("state reset", this::clearState);
        } catch (IllegalStateException e) {
            return errorResponse(HttpStatus.CONFLICT, e.getMessage());
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.putAll(cleared);
        return ResponseEntity.ok(response);
    }

    private Map<String, Object> clearState() {
        int seen = seenStore.size();
        int identities = registry.size();
        seenStore.reset();
        registry.reset();
        log.warn("State reset via API: {} seen messages and {} ticket identities cleared", seen, identities);
        Map<String, Object> cleared = new LinkedHashMap<>();
        cleared.put("seenCleared", seen);
        cleared.put("identitiesCleared", identities);
        return cleared;
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}
