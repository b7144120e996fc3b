package com.mailsync.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * DatabaseConfig unit tests
 */
class DatabaseConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Parent directory of the SQLite file is created")
    void testPrepareDatabaseDirectory() {
        Path db = tempDir.resolve("nested/store/mailsync.db");

        DatabaseConfig.prepareDatabaseDirectory("jdbc:sqlite:" + db + "?journal_mode=WAL");

        assertThat(Files.isDirectory(db.getParent())).isTrue();
        assertThat(Files.exists(db)).isFalse();
    }

    @Test
    @DisplayName("In-memory and non-SQLite URLs are left alone")
    void testPrepareDatabaseDirectory_Skipped() {
        assertThatCode(() -> {
            DatabaseConfig.prepareDatabaseDirectory("jdbc:sqlite::memory:");
            DatabaseConfig.prepareDatabaseDirectory("jdbc:h2:mem:test");
            DatabaseConfig.prepareDatabaseDirectory(null);
        }).doesNotThrowAnyException();
    }
}
