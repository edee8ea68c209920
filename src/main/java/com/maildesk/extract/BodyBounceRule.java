package com.maildesk.extract;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(4)
public class BodyBounceRule implements BounceRule {

    @Override
    public boolean matches(BounceCandidate candidate) {
        for (String text : candidate.textParts()) {
            if (BounceNeedles.containsAny(text, BounceNeedles.BODY)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String reason() {
        return "Undelivered Mail/Return";
    }
}
