package com.maildesk.store;

import java.util.UUID;

public final class TicketIds {

    public static final String PREFIX = "TKT-";

    private TicketIds() {}

    public static String newTicketId() {
        return PREFIX + UUID.randomUUID().toString().toUpperCase();
    }
}
