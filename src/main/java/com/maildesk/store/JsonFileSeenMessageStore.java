package com.maildesk.store;

import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Seen-message store kept as a sorted JSON array of unique ids.
 * Single-instance only; see {@link InstanceLock}.
 */
@Slf4j
public class JsonFileSeenMessageStore implements SeenMessageStore {

    private final JsonStateFile file;
    private final Set<String> seen = new TreeSet<>();

    public JsonFileSeenMessageStore(Path path) {
        this.file = new JsonStateFile(path);
    }

    public synchronized void load() {
        seen.clear();
        List<String> stored = file.read(new TypeReference<List<String>>() {});
        if (stored != null) {
            seen.addAll(stored);
        }
        log.info("Seen-message store loaded from {}: {} entries", file.getPath(), seen.size());
    }

    @Override
    public synchronized boolean has(String uniqueId) {
        return seen.contains(uniqueId);
    }

    @Override
    public synchronized void markSeen(String uniqueId) {
        if (!seen.add(uniqueId)) {
            return;
        }
        try {
            file.write(seen);
        } catch (RuntimeException e) {
            seen.remove(uniqueId);
            throw e;
        }
    }

    @Override
    public synchronized int size() {
        return seen.size();
    }

    @Override
    public synchronized void reset() {
        file.write(List.of());
        seen.clear();
        log.warn("Seen-message store reset: {}", file.getPath());
    }
}
