package com.maildesk.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * DatabaseConfig unit tests
 */
class DatabaseConfigTest {

    @Test
    @DisplayName("Database file is read from the SQLite URL")
    void testSqliteFile() {
        assertThat(DatabaseConfig.sqliteFile("jdbc:sqlite:data/maildesk.db?busy_timeout=5000"))
                .isEqualTo(Paths.get("data/maildesk.db"));
        assertThat(DatabaseConfig.sqliteFile("jdbc:sqlite:file:/var/lib/maildesk/db.sqlite"))
                .isEqualTo(Paths.get("/var/lib/maildesk/db.sqlite"));
    }

    @Test
    @DisplayName("In-memory and foreign URLs have no file")
    void testNoFile() {
        assertThat(DatabaseConfig.sqliteFile("jdbc:sqlite::memory:")).isNull();
        assertThat(DatabaseConfig.sqliteFile("jdbc:h2:mem:test")).isNull();
        assertThat(DatabaseConfig.sqliteFile(null)).isNull();
    }
}
