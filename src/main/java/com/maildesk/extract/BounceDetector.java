package com.maildesk.extract;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Runs the registered bounce rules in order; the first match wins
 */
@Component
@RequiredArgsConstructor
public class BounceDetector {

    private final List<BounceRule> rules;

    public static BounceDetector withDefaultRules() {
        return new BounceDetector(List.of(
                new SenderBounceRule(),
                new SubjectBounceRule(),
                new DeliveryReportBounceRule(),
                new BodyBounceRule()));
    }

    /**
     * @return reason of the first matching rule, empty for a normal message
     */
    public Optional<String> detect(BounceCandidate candidate) {
        for (BounceRule rule : rules) {
            if (rule.matches(candidate)) {
                return Optional.of(rule.reason());
            }
        }
        return Optional.empty();
    }
}
