package com.maildesk.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InstanceLock unit tests
 */
class InstanceLockTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Second holder of the same lock file is rejected")
    void testExclusive() throws Exception {
        Path file = tempDir.resolve("state/maildesk.lock");
        try (InstanceLock first = new InstanceLock(file)) {
            first.acquire();
            assertThat(first.isHeld()).isTrue();

            InstanceLock second = new InstanceLock(file);
            assertThatThrownBy(second::acquire).isInstanceOf(IllegalStateException.class);
            assertThat(second.isHeld()).isFalse();
        }
    }

    @Test
    @DisplayName("Lock can be taken again after release")
    void testReacquire() throws Exception {
        Path file = tempDir.resolve("maildesk.lock");
        InstanceLock first = new InstanceLock(file);
        first.acquire();
        first.close();
        assertThat(first.isHeld()).isFalse();

        try (InstanceLock second = new InstanceLock(file)) {
            second.acquire();
            assertThat(second.isHeld()).isTrue();
        }
    }
}
