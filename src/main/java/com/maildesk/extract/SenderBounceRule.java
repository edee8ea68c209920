package com.maildesk.extract;

import com.maildesk.util.CryptoUtil;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Sender is a mailer daemon or postmaster mailbox
 */
@Component
@Order(1)
public class SenderBounceRule implements BounceRule {

    private static final Set<String> DAEMON_LOCAL_PARTS = Set.of(
            "mailer-daemon", "postmaster", "mail-daemon", "mailerdaemon");

    @Override
    public boolean matches(BounceCandidate candidate) {
        String sender = candidate.sender();
        if (sender == null || sender.isEmpty()) {
            return false;
        }
        String local = CryptoUtil.extractLocalPart(sender).toLowerCase(Locale.ROOT);
        return DAEMON_LOCAL_PARTS.contains(local);
    }

    @Override
    public String reason() {
        return "Mailer daemon sender";
    }
}
