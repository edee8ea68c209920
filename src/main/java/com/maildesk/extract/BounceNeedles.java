package com.maildesk.extract;

import java.util.List;
import java.util.Locale;

final class BounceNeedles {

    static final List<String> SUBJECT = List.of(
            "undelivered",
            "undeliverable",
            "return to sender",
            "returned mail",
            "mail delivery failed",
            "delivery failure",
            "delivery status notification",
            "mailer-daemon",
            "bounce");

    // "bounce" alone is too common in customer text
    static final List<String> BODY = List.of(
            "undelivered",
            "return to sender",
            "mail delivery failed",
            "delivery status notification",
            "mailer-daemon");

    private BounceNeedles() {}

    static boolean containsAny(String text, List<String> needles) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String needle : needles) {
            if (lower.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
