package com.maildesk.store;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Exclusive lock file guarding the state directory against a second running instance
 */
@Slf4j
public class InstanceLock implements AutoCloseable {

    private final Path path;
    private FileChannel channel;
    private FileLock lock;

    public InstanceLock(Path path) {
        this.path = path;
    }

    /**
     * @throws IllegalStateException when another process holds the lock
     */
    public synchronized void acquire() throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            lock = null;
        }
        if (lock == null) {
            channel.close();
            channel = null;
            throw new IllegalStateException("Another MailDesk instance holds " + path);
        }
        log.info("Instance lock acquired: {}", path);
    }

    public synchronized boolean isHeld() {
        return lock != null && lock.isValid();
    }

    @Override
    public synchronized void close() throws IOException {
        if (lock != null) {
            lock.release();
            lock = null;
        }
        if (channel != null) {
            channel.close();
            channel = null;
        }
        log.info("Instance lock released: {}", path);
    }
}
