package com.maildesk.extract;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2)
public class SubjectBounceRule implements BounceRule {

    @Override
    public boolean matches(BounceCandidate candidate) {
        return BounceNeedles.containsAny(candidate.subject(), BounceNeedles.SUBJECT);
    }

    @Override
    public String reason() {
        return "Undelivered Mail/Return";
    }
}
