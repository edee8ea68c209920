package com.maildesk.controller;

import com.maildesk.config.MailDeskProperties;
import com.maildesk.poll.PollRunner;
import com.maildesk.service.PollCycleResult;
import com.maildesk.service.TicketRecordService;
import com.maildesk.store.SeenMessageStore;
import com.maildesk.store.TicketIdentityRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ingestion diagnostic endpoint.
 * Hit GET /api/diagnostic to see mailbox configuration, state sizes and the last poll cycle.
 */
@Slf4j
@RestController
@RequestMapping("/api/diagnostic")
@RequiredArgsConstructor
public class DiagnosticController {

    private final MailDeskProperties properties;
    private final SeenMessageStore seenStore;
    private final TicketIdentityRegistry registry;
    private final TicketRecordService recordService;
    private final PollRunner pollRunner;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> diagnostic() {
        Map<String, Object> result = new LinkedHashMap<>();

        // Mailbox config (credentials never exposed)
        MailDeskProperties.Mail mail = properties.getMail();
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("protocol", mail.getProtocol());
        config.put("host", mail.getHost());
        config.put("port", mail.getPort());
        config.put("username", mail.getUsername());
        config.put("folder", mail.getFolder());
        config.put("deleteAfterSeal", mail.isDeleteAfterSeal());
        config.put("pollMode", properties.getPoll().getMode());
        config.put("pollIntervalMs", properties.getPoll().getIntervalMs());
        config.put("attachmentPath", properties.getStorage().getAttachmentPath());
        result.put("config", config);

        Map<String, Object> state = new LinkedHashMap<>();
        state.put("backend", properties.getState().getBackend());
        state.put("seenMessages", seenStore.size());
        state.put("ticketIdentities", registry.size());
        state.put("tickets", recordService.countTickets());
        result.put("state", state);

        Map<String, Object> poll = new LinkedHashMap<>();
        poll.put("running", pollRunner.isRunning());
        PollCycleResult last = pollRunner.getLastResult();
        poll.put("lastCycle", last != null ? last : "none");
        result.put("poll", poll);

        log.info("Diagnostic check performed");
        return result;
    }
}
