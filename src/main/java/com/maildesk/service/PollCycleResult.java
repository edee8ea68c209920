package com.maildesk.service;

import lombok.Data;

/**
 * Counters for one poll cycle
 */
@Data
public class PollCycleResult {

    private int candidates;
    private int created;
    private int followUps;
    private int deduplicated;
    private int resumed;
    private int failed;
    private boolean aborted;
    private String abortReason;

    public void record(ProcessOutcome outcome) {
        switch (outcome) {
            case CREATED -> created++;
            case FOLLOW_UP -> followUps++;
            case DEDUPLICATED -> deduplicated++;
            case RESUMED -> resumed++;
            case FAILED -> failed++;
        }
    }

    public void abort(String reason) {
        this.aborted = true;
        this.abortReason = reason;
    }
}
