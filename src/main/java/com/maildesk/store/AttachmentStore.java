package com.maildesk.store;

import com.maildesk.config.MailDeskProperties;
import com.maildesk.exception.StorageException;
import com.maildesk.util.AttachmentPathUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * Filesystem attachment store
 * - One directory per ticket
 * - Existing files are never overwritten: name collisions get a -n suffix
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AttachmentStore {

    private static final int MAX_COLLISIONS = 10000;

    private final MailDeskProperties properties;

    /**
     * Write attachment bytes under the ticket directory
     *
     * @return reference resolving to the written bytes
     * @throws StorageException on any filesystem failure
     */
    public AttachmentReference save(String ticketId, String messageUid, String filename,
                                    String contentType, byte[] data, AttachmentKind kind) {
        String basePath = basePath();
        String safeName = AttachmentPathUtil.sanitizeFilename(filename,
                properties.getStorage().getMaxFilenameLength());
        Path dir = AttachmentPathUtil.ticketDirectory(basePath, ticketId);

        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Cannot create attachment directory " + dir, e);
        }

        for (int n = 0; n < MAX_COLLISIONS; n++) {
            Path target = dir.resolve(AttachmentPathUtil.withSuffix(safeName, n));
            try {
                writeNew(target, data);
            } catch (FileAlreadyExistsException e) {
                continue;
            } catch (IOException e) {
                StorageException failure = new StorageException("Cannot write attachment " + target, e);
                discardPartial(target, failure);
                throw failure;
            }
            String relative = AttachmentPathUtil.relativize(basePath, target);
            log.info("Attachment saved: {} ({} bytes)", target, data.length);
            return new AttachmentReference(ticketId, messageUid, relative,
                    filename == null || filename.isBlank() ? safeName : filename,
                    contentType, data.length, kind);
        }
        throw new StorageException("Too many attachments named " + safeName + " for ticket " + ticketId);
    }

    /**
     * Create the file; fails with FileAlreadyExistsException when the name is taken
     */
    void writeNew(Path target, byte[] data) throws IOException {
        Files.write(target, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    }

    // any other IOException means the file, if present, was created by this write
    private static void discardPartial(Path target, StorageException failure) {
        try {
            if (Files.deleteIfExists(target)) {
                log.warn("Partially written attachment removed: {}", target);
            }
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    /**
     * Read attachment bytes
     */
    public byte[] read(String storedPath) {
        Path file = resolve(storedPath);
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new StorageException("Cannot read attachment " + storedPath, e);
        }
    }

    /**
     * Delete attachment; used to roll back files of a message that failed to persist
     */
    public boolean delete(AttachmentReference reference) {
        try {
            return Files.deleteIfExists(resolve(reference.storedPath()));
        } catch (IOException e) {
            log.error("Failed to delete attachment: {}", reference.storedPath(), e);
            return false;
        }
    }

    private Path resolve(String storedPath) {
        Path base = Paths.get(basePath()).toAbsolutePath().normalize();
        Path file = base.resolve(storedPath).normalize();
        if (!file.startsWith(base)) {
            throw new StorageException("Attachment path escapes storage root: " + storedPath);
        }
        return file;
    }

    private String basePath() {
        return properties.getStorage().getAttachmentPath();
    }
}
