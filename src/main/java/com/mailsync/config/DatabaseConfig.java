package com.mailsync.config;

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

/**
 * SQLite store bootstrap
 * - Creates the parent directory of the database file
 * - Applies schema.sql on startup (CREATE ... IF NOT EXISTS)
 */
@Slf4j
@Configuration
public class DatabaseConfig {

    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    @Bean
    public DataSourceInitializer syncStoreInitializer(DataSource dataSource, DataSourceProperties dataSourceProperties) {
        prepareDatabaseDirectory(dataSourceProperties.getUrl());

        ResourceDatabasePopulator schema = new ResourceDatabasePopulator(new ClassPathResource("schema.sql"));
        schema.setContinueOnError(false);

        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(dataSource);
        initializer.setDatabasePopulator(schema);
        return initializer;
    }

    static void prepareDatabaseDirectory(String url) {
        if (url == null || !url.startsWith(SQLITE_PREFIX)) {
            return;
        }
        String file = url.substring(SQLITE_PREFIX.length());
        int query = file.indexOf('?');
        if (query >= 0) {
            file = file.substring(0, query);
        }
        if (file.isEmpty() || file.startsWith(":memory:") || file.startsWith("file::memory:")) {
            return;
        }

        Path parent = Path.of(file).toAbsolutePath().getParent();
        if (parent == null || Files.isDirectory(parent)) {
            return;
        }
        try {
            Files.createDirectories(parent);
            log.info("Created SQLite data directory {}", parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create SQLite data directory " + parent, e);
        }
    }
}
