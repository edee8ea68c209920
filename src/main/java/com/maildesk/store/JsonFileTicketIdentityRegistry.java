package com.maildesk.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.maildesk.domain.TicketIdentity;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Identity registry kept as a JSON object keyed by conversation key.
 * There is no atomic insert across processes here, so this backend relies on
 * {@link InstanceLock} for single-instance operation.
 */
@Slf4j
public class JsonFileTicketIdentityRegistry implements TicketIdentityRegistry {

    private final JsonStateFile file;
    private final Map<String, TicketIdentity> identities = new TreeMap<>();

    public JsonFileTicketIdentityRegistry(Path path) {
        this.file = new JsonStateFile(path);
    }

    public synchronized void load() {
        identities.clear();
        Map<String, TicketIdentity> stored = file.read(new TypeReference<Map<String, TicketIdentity>>() {});
        if (stored != null) {
            identities.putAll(stored);
        }
        log.info("Ticket identity registry loaded from {}: {} entries", file.getPath(), identities.size());
    }

    @Override
    public synchronized TicketResolution resolveOrCreate(String conversationKey) {
        TicketIdentity known = identities.get(conversationKey);
        if (known != null) {
            return new TicketResolution(known.getTicketId(), false);
        }

        TicketIdentity identity = TicketIdentity.builder()
                .conversationKey(conversationKey)
                .ticketId(TicketIds.newTicketId())
                .createdAt(LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME))
                .build();
        identities.put(conversationKey, identity);
        try {
            file.write(identities);
        } catch (RuntimeException e) {
            identities.remove(conversationKey);
            throw e;
        }
        log.info("Ticket id {} assigned to conversation {}", identity.getTicketId(), conversationKey);
        return new TicketResolution(identity.getTicketId(), true);
    }

    @Override
    public synchronized Optional<String> find(String conversationKey) {
        TicketIdentity identity = identities.get(conversationKey);
        return identity == null ? Optional.empty() : Optional.of(identity.getTicketId());
    }

    @Override
    public synchronized int size() {
        return identities.size();
    }

    @Override
    public synchronized void reset() {
        file.write(Map.of());
        identities.clear();
        log.warn("Ticket identity registry reset: {}", file.getPath());
    }
}
