package com.maildesk.poll;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fixed-delay mailbox polling; a new cycle starts only after the previous one finished
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "maildesk.poll.mode", havingValue = "scheduled", matchIfMissing = true)
public class PollScheduler {

    private final PollRunner pollRunner;

    @Scheduled(fixedDelayString = "${maildesk.poll.interval-ms:60000}",
            initialDelayString = "${maildesk.poll.initial-delay-ms:5000}")
    public void poll() {
        log.debug("=== Scheduled Job: Mailbox Poll ===");
        try {
            pollRunner.runCycle();
        } catch (IllegalStateException e) {
            log.warn("Scheduled poll skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Error during scheduled poll", e);
        }
    }
}
