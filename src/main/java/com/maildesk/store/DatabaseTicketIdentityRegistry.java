package com.maildesk.store;

import com.maildesk.domain.TicketIdentity;
import com.maildesk.exception.IdentityConflictException;
import com.maildesk.exception.StorageException;
import com.maildesk.mapper.TicketIdentityMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Identity registry backed by the ticket_identity table.
 * The create path is INSERT OR IGNORE followed by a read of the stored row, so
 * processes racing on one key all return the id of whichever insert landed.
 */
@Slf4j
public class DatabaseTicketIdentityRegistry implements TicketIdentityRegistry {

    private final TicketIdentityMapper mapper;
    private final Map<String, String> identities = new ConcurrentHashMap<>();

    public DatabaseTicketIdentityRegistry(TicketIdentityMapper mapper) {
        this.mapper = mapper;
    }

    public void load() {
        identities.clear();
        for (TicketIdentity identity : mapper.findAll()) {
            identities.put(identity.getConversationKey(), identity.getTicketId());
        }
        log.info("Ticket identity registry loaded from database: {} entries", identities.size());
    }

    @Override
    public TicketResolution resolveOrCreate(String conversationKey) {
        String known = identities.get(conversationKey);
        if (known != null) {
            return new TicketResolution(known, false);
        }

        try {
            // Another instance may have assigned the key since startup
            TicketIdentity stored = mapper.findByKey(conversationKey);
            if (stored != null) {
                identities.put(conversationKey, stored.getTicketId());
                return new TicketResolution(stored.getTicketId(), false);
            }

            TicketIdentity candidate = TicketIdentity.builder()
                    .conversationKey(conversationKey)
                    .ticketId(TicketIds.newTicketId())
                    .createdAt(LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME))
                    .build();
            int inserted = mapper.insertIfAbsent(candidate);

            TicketIdentity winner = mapper.findByKey(conversationKey);
            if (winner == null) {
                throw new IdentityConflictException("No ticket id stored for conversation key after insert: " + conversationKey);
            }
            identities.put(conversationKey, winner.getTicketId());

            boolean created = inserted > 0 && candidate.getTicketId().equals(winner.getTicketId());
            if (created) {
                log.info("Ticket id {} assigned to conversation {}", winner.getTicketId(), conversationKey);
            } else {
                log.info("Conversation {} was assigned concurrently to {}", conversationKey, winner.getTicketId());
            }
            return new TicketResolution(winner.getTicketId(), created);
        } catch (IdentityConflictException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StorageException("Failed to resolve ticket id for " + conversationKey, e);
        }
    }

    @Override
    public Optional<String> find(String conversationKey) {
        return Optional.ofNullable(identities.get(conversationKey));
    }

    @Override
    public int size() {
        return identities.size();
    }

    @Override
    public void reset() {
        try {
            mapper.deleteAll();
        } catch (RuntimeException e) {
            throw new StorageException("Failed to reset ticket identity registry", e);
        }
        identities.clear();
        log.warn("Ticket identity registry reset");
    }
}
