package objectsdb.config;

import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Loads {@link DatabaseConfig} from an INI file.
 * Sections: [DATABASE] (required), [TASKS] (optional).
 *
 * <pre>
 * [DATABASE]
 * host = wgs36
 * port = 5432
 * user = willow
 * password = willow
 * dbname = household_objects
 * ; url = jdbc:h2:file:./data/objects   (overrides host/port/dbname)
 * pool_size = 10
 *
 * [TASKS]
 * claim_batch_size = 8
 * claim_timeout_ms = 5000
 * </pre>
 */
public final class DatabaseConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(DatabaseConfigLoader.class);

    private DatabaseConfigLoader() {
    }

    public static Optional<DatabaseConfig> load(File file) {
        Ini ini;
        try {
            ini = new Ini(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read database config: " + file, e);
        }

        Profile.Section db = ini.get("DATABASE");
        Profile.Section tasks = ini.get("TASKS");

        if (db == null) {
            log.warn("No [DATABASE] section in {}", file);
            return Optional.empty();
        }

        DatabaseConfig cfg = DatabaseConfig.defaults();

        // DATABASE
        String url = opt(db, "url");
        if (url != null) {
            cfg.withDatabaseUrl(url);
        }
        String host = opt(db, "host");
        if (host != null) {
            cfg.withHost(host);
        }
        cfg.withPort(Integer.parseInt(opt(db, "port", String.valueOf(cfg.port()))));
        cfg.withCredentials(opt(db, "user"), opt(db, "password"));
        String dbname = opt(db, "dbname");
        if (dbname != null) {
            cfg.withDatabaseName(dbname);
        }
        cfg.withPoolSize(Integer.parseInt(opt(db, "pool_size", String.valueOf(cfg.poolSize()))));

        // TASKS (optional)
        if (tasks != null) {
            cfg.withClaimBatchSize(Integer.parseInt(
                    opt(tasks, "claim_batch_size", String.valueOf(cfg.claimBatchSize()))));
            String timeout = opt(tasks, "claim_timeout_ms");
            if (timeout != null) {
                cfg.withClaimTimeout(Duration.ofMillis(Long.parseLong(timeout)));
            }
        }

        log.info("Loaded database config from {}: {}", file, cfg);
        return Optional.of(cfg);
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        String v = s == null ? null : s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return v == null ? def : v;
    }
}
