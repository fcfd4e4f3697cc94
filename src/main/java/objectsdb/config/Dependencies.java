package objectsdb.config;

import objectsdb.repository.ObjectsRepository;
import objectsdb.repository.TaskRepository;
import objectsdb.service.ObjectsService;
import objectsdb.service.TaskService;
import objectsdb.store.Database;
import objectsdb.store.JdbcObjectsRepository;
import objectsdb.store.JdbcTaskRepository;
import objectsdb.store.QueryBuilder;
import objectsdb.store.TaskClaimCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates the connection pool and hands it to every component that needs it.
 *
 * Usage:
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(DatabaseConfig.fromEnv())) {
 *     Optional&lt;Task&gt; task = deps.taskService().acquireNextTask("worker-1");
 *     // ...
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final DatabaseConfig config;
    private final Database database;
    private final QueryBuilder queryBuilder;
    private final TaskClaimCoordinator claimCoordinator;
    private final TaskRepository taskRepository;
    private final ObjectsRepository objectsRepository;
    private final TaskService taskService;
    private final ObjectsService objectsService;

    private Dependencies(DatabaseConfig config) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.queryBuilder = new QueryBuilder(database);
        this.claimCoordinator = new TaskClaimCoordinator(database, queryBuilder,
                config.claimBatchSize(), config.claimTimeout());

        // Repositories
        this.taskRepository = new JdbcTaskRepository(queryBuilder, claimCoordinator);
        this.objectsRepository = new JdbcObjectsRepository(queryBuilder);

        // Services
        this.taskService = new TaskService(taskRepository);
        this.objectsService = new ObjectsService(objectsRepository);

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(DatabaseConfig config) {
        return new Dependencies(config);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(DatabaseConfig.fromEnv());
    }

    // Getters
    public DatabaseConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public QueryBuilder queryBuilder() {
        return queryBuilder;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public ObjectsRepository objectsRepository() {
        return objectsRepository;
    }

    public TaskService taskService() {
        return taskService;
    }

    public ObjectsService objectsService() {
        return objectsService;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }
        log.info("Dependencies closed");
    }
}
