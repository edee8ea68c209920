package com.maildesk.store;

import com.maildesk.domain.SeenMessage;
import com.maildesk.exception.StorageException;
import com.maildesk.mapper.SeenMessageMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Seen-message store backed by the seen_message table.
 * Insert-if-absent keeps concurrent writers from failing on each other.
 */
@Slf4j
public class DatabaseSeenMessageStore implements SeenMessageStore {

    private final SeenMessageMapper mapper;
    private final Set<String> seen = ConcurrentHashMap.newKeySet();

    public DatabaseSeenMessageStore(SeenMessageMapper mapper) {
        this.mapper = mapper;
    }

    public void load() {
        seen.clear();
        seen.addAll(mapper.findAllUids());
        log.info("Seen-message store loaded from database: {} entries", seen.size());
    }

    @Override
    public boolean has(String uniqueId) {
        return seen.contains(uniqueId);
    }

    @Override
    public void markSeen(String uniqueId) {
        if (seen.contains(uniqueId)) {
            return;
        }
        try {
            mapper.insertIfAbsent(SeenMessage.builder()
                    .messageUid(uniqueId)
                    .seenAt(LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME))
                    .build());
        } catch (RuntimeException e) {
            throw new StorageException("Failed to record seen message " + uniqueId, e);
        }
        seen.add(uniqueId);
    }

    @Override
    public int size() {
        return seen.size();
    }

    @Override
    public void reset() {
        try {
            mapper.deleteAll();
        } catch (RuntimeException e) {
            throw new StorageException("Failed to reset seen-message store", e);
        }
        seen.clear();
        log.warn("Seen-message store reset");
    }
}
