package com.maildesk.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * SQLite schema initialization
 * - Parent directories of the database file and the state directory are created first
 * - schema.sql is idempotent (CREATE ... IF NOT EXISTS) and runs on every start
 */
@Slf4j
@Configuration
public class DatabaseConfig {

    static final String SQLITE_PREFIX = "jdbc:sqlite:";

    @Bean
    public DataSourceInitializer dataSourceInitializer(DataSource dataSource,
                                                       DataSourceProperties dataSourceProperties,
                                                       MailDeskProperties properties) {
        createDirectory(Paths.get(properties.getState().getDirectory()));
        Path databaseFile = sqliteFile(dataSourceProperties.getUrl());
        if (databaseFile != null && databaseFile.toAbsolutePath().getParent() != null) {
            createDirectory(databaseFile.toAbsolutePath().getParent());
        }

        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        populator.addScript(new ClassPathResource("schema.sql"));
        populator.setContinueOnError(false);

        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(dataSource);
        initializer.setDatabasePopulator(populator);
        log.info("Database schema will be applied to {}", databaseFile != null ? databaseFile : "in-memory database");
        return initializer;
    }

    /**
     * Database file of a jdbc:sqlite URL; null for in-memory databases and other drivers
     */
    static Path sqliteFile(String url) {
        if (url == null || !url.startsWith(SQLITE_PREFIX)) {
            return null;
        }
        String location = url.substring(SQLITE_PREFIX.length());
        int query = location.indexOf('?');
        if (query >= 0) {
            location = location.substring(0, query);
        }
        if (location.isEmpty() || location.startsWith(":memory:") || location.startsWith("file::memory:")) {
            return null;
        }
        if (location.startsWith("file:")) {
            location = location.substring("file:".length());
        }
        return Paths.get(location);
    }

    private static void createDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory " + dir, e);
        }
    }
}
