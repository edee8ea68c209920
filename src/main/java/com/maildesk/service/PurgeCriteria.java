package com.maildesk.service;

import java.time.Instant;

/**
 * Filters for a mailbox purge; null fields are ignored
 *
 * @param before          only messages with a Date header strictly before this instant
 * @param fromContains    case-insensitive substring of the sender address
 * @param subjectRegex    case-insensitive pattern searched in the subject
 * @param undeliveredOnly true: bounces only, false: non-bounces only
 * @param dryRun          report matches without deleting
 */
public record PurgeCriteria(Instant before,
                            String fromContains,
                            String subjectRegex,
                            Boolean undeliveredOnly,
                            boolean dryRun) {
}
