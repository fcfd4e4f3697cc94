package objectsdb.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseConfigTest {

    @Test
    void defaults() {
        DatabaseConfig config = DatabaseConfig.defaults();

        assertEquals("jdbc:postgresql://localhost:5432/household_objects", config.jdbcUrl());
        assertEquals(10, config.poolSize());
        assertEquals(8, config.claimBatchSize());
        assertNull(config.claimTimeout());
        assertFalse(config.initSchema());
    }

    @Test
    void urlIsBuiltFromConnectionParameters() {
        DatabaseConfig config = DatabaseConfig.defaults()
                .withHost("wgs36")
                .withPort(5433)
                .withDatabaseName("objects")
                .withCredentials("willow", "secret");

        assertEquals("jdbc:postgresql://wgs36:5433/objects", config.jdbcUrl());
        assertEquals("willow", config.user());
        assertEquals("secret", config.password());
    }

    @Test
    void explicitUrlWins() {
        DatabaseConfig config = DatabaseConfig.defaults()
                .withHost("wgs36")
                .withDatabaseUrl("jdbc:h2:mem:objects");

        assertEquals("jdbc:h2:mem:objects", config.jdbcUrl());
    }

    @Test
    void claimSettings() {
        DatabaseConfig config = DatabaseConfig.defaults()
                .withClaimBatchSize(2)
                .withClaimTimeout(Duration.ofSeconds(3));

        assertEquals(2, config.claimBatchSize());
        assertEquals(Duration.ofSeconds(3), config.claimTimeout());
        assertThrows(IllegalArgumentException.class, () -> config.withClaimBatchSize(0));
    }

    @Test
    void toStringHidesPassword() {
        String text = DatabaseConfig.defaults().withCredentials("willow", "secret").toString();

        assertFalse(text.contains("secret"));
        assertTrue(text.contains("passwordSet=true"));
    }
}
