package com.maildesk.store;

import com.maildesk.exception.StorageException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JsonFileSeenMessageStore unit tests
 */
class JsonFileSeenMessageStoreTest {

    @TempDir
    Path tempDir;

    private JsonFileSeenMessageStore open(Path file) {
        JsonFileSeenMessageStore store = new JsonFileSeenMessageStore(file);
        store.load();
        return store;
    }

    @Test
    @DisplayName("Missing file loads as an empty store")
    void testLoadMissingFile() {
        JsonFileSeenMessageStore store = open(tempDir.resolve("seen.json"));

        assertThat(store.size()).isZero();
        assertThat(store.has("u-1")).isFalse();
    }

    @Test
    @DisplayName("Seen ids survive a reload")
    void testDurableAcrossReload() {
        Path file = tempDir.resolve("state/seen.json");
        JsonFileSeenMessageStore store = open(file);
        store.markSeen("u-100");
        store.markSeen("u-101");
        store.markSeen("u-100");

        JsonFileSeenMessageStore reloaded = open(file);

        assertThat(reloaded.size()).isEqualTo(2);
        assertThat(reloaded.has("u-100")).isTrue();
        assertThat(reloaded.has("u-101")).isTrue();
        assertThat(reloaded.has("u-102")).isFalse();
    }

    @Test
    @DisplayName("No temp file is left after a write")
    void testNoTempFileLeft() {
        Path file = tempDir.resolve("seen.json");
        open(file).markSeen("u-1");

        assertThat(file).exists();
        assertThat(tempDir.resolve("seen.json.tmp")).doesNotExist();
    }

    @Test
    @DisplayName("Corrupt file fails loading")
    void testCorruptFile() throws IOException {
        Path file = tempDir.resolve("seen.json");
        Files.write(file, "[\"u-1\", ".getBytes(StandardCharsets.UTF_8));

        JsonFileSeenMessageStore store = new JsonFileSeenMessageStore(file);

        assertThatThrownBy(store::load).isInstanceOf(StorageException.class);
    }

    @Test
    @DisplayName("Failed write does not report the id as seen")
    void testFailedWriteNotSeen() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.write(blocker, new byte[0]);
        // Parent "directory" is a regular file, so every write fails
        JsonFileSeenMessageStore store = open(blocker.resolve("seen.json"));

        assertThatThrownBy(() -> store.markSeen("u-1")).isInstanceOf(StorageException.class);
        assertThat(store.has("u-1")).isFalse();
    }

    @Test
    @DisplayName("Reset empties the store on disk")
    void testReset() {
        Path file = tempDir.resolve("seen.json");
        JsonFileSeenMessageStore store = open(file);
        store.markSeen("u-1");

        store.reset();

        assertThat(store.size()).isZero();
        assertThat(open(file).size()).isZero();
    }
}
