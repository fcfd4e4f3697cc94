package objectsdb.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseConfigLoaderTest {

    @TempDir
    Path dir;

    @Test
    void loadsDatabaseAndTaskSections() throws IOException {
        File file = write("""
                [DATABASE]
                host = wgs36
                port = 5433
                user = willow
                password = willow
                dbname = household_objects
                pool_size = 4

                [TASKS]
                claim_batch_size = 3
                claim_timeout_ms = 2500
                """);

        Optional<DatabaseConfig> loaded = DatabaseConfigLoader.load(file);

        assertTrue(loaded.isPresent());
        DatabaseConfig config = loaded.get();
        assertEquals("jdbc:postgresql://wgs36:5433/household_objects", config.jdbcUrl());
        assertEquals("willow", config.user());
        assertEquals(4, config.poolSize());
        assertEquals(3, config.claimBatchSize());
        assertEquals(Duration.ofMillis(2500), config.claimTimeout());
    }

    @Test
    void explicitUrlAndDefaults() throws IOException {
        File file = write("""
                [DATABASE]
                url = jdbc:h2:mem:loader
                """);

        DatabaseConfig config = DatabaseConfigLoader.load(file).orElseThrow();

        assertEquals("jdbc:h2:mem:loader", config.jdbcUrl());
        assertNull(config.user());
        assertEquals(10, config.poolSize());
        assertEquals(8, config.claimBatchSize());
        assertNull(config.claimTimeout());
    }

    @Test
    void missingDatabaseSectionGivesEmpty() throws IOException {
        File file = write("""
                [TASKS]
                claim_batch_size = 3
                """);

        assertTrue(DatabaseConfigLoader.load(file).isEmpty());
    }

    @Test
    void unreadableFileFails() {
        File missing = dir.resolve("missing.ini").toFile();

        assertThrows(UncheckedIOException.class, () -> DatabaseConfigLoader.load(missing));
    }

    private File write(String content) throws IOException {
        Path file = dir.resolve("objects.ini");
        Files.writeString(file, content);
        return file.toFile();
    }
}
