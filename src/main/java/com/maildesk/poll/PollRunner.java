package com.maildesk.poll;

import com.maildesk.exception.MailTransportException;
import com.maildesk.service.IngestionPipeline;
import com.maildesk.service.PollCycleResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs poll cycles one at a time and maps their result to a process exit code.
 * Purge and reset share the same guard.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PollRunner {

    public static final int EXIT_OK = 0;
    public static final int EXIT_MAIL_UNREACHABLE = 2;

    private final IngestionPipeline pipeline;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<PollCycleResult> lastResult = new AtomicReference<>();

    /**
     * @return the cycle result; aborted when the mailbox could not be reached
     * @throws IllegalStateException when a cycle or another exclusive operation is running
     */
    public PollCycleResult runCycle() {
        return runExclusive("poll cycle", () -> {
            PollCycleResult result;
            try {
                result = pipeline.runCycle();
            } catch (MailTransportException e) {
                log.error("Poll cycle aborted, mailbox unreachable: {}", e.getMessage(), e);
                result = new PollCycleResult();
                result.abort(e.getMessage());
            }
            lastResult.set(result);
            return result;
        });
    }

    /**
     * Run work that must not overlap a poll cycle, such as a mailbox purge or a state reset
     *
     * @throws IllegalStateException when a cycle or another exclusive operation is running
     */
    public <T> T runExclusive(String operation, Supplier<T> work) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Cannot start " + operation + ", a poll cycle or mailbox operation is running");
        }
        try {
            return work.get();
        } finally {
            running.set(false);
        }
    }

    /**
     * Single cycle for run-once mode
     */
    public int runOnce() {
        PollCycleResult result = runCycle();
        return result.isAborted() ? EXIT_MAIL_UNREACHABLE : EXIT_OK;
    }

    public PollCycleResult getLastResult() {
        return lastResult.get();
    }

    public boolean isRunning() {
        return running.get();
    }
}
