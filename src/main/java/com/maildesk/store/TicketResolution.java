package com.maildesk.store;

/**
 * @param ticketId ticket id bound to the conversation key
 * @param created  true when this call assigned the id
 */
public record TicketResolution(String ticketId, boolean created) {
}
