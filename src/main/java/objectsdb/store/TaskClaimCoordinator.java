package objectsdb.store;

import objectsdb.ClaimException;
import objectsdb.model.Task;
import objectsdb.model.TaskStatus;
import objectsdb.query.Predicate;
import objectsdb.schema.EntityDescriptor;
import objectsdb.schema.EntityRow;
import objectsdb.store.mapping.TaskMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Hands each PENDING task to exactly one worker.
 *
 * <p>The claim is a compare-and-set on the task row:
 * <pre>
 * UPDATE task SET status = 'RUNNING', claimed_by = ?, claimed_at = ?
 *  WHERE task_id = ? AND status = 'PENDING'
 * </pre>
 * The store's row lock serializes concurrent updates of the same row. A worker
 * that loses the race re-evaluates {@code status = 'PENDING'} once the winner
 * commits, updates nothing, and moves on to the next candidate. The candidate
 * read beforehand only supplies the order (oldest task id first) and takes no lock.
 *
 * <p>Holds no in-process lock and no state between calls. Any store failure
 * rolls the transaction back, so a failed or timed-out claim leaves the row PENDING.
 * A caller's timeout also becomes the lock timeout of the claim's connection
 * (see {@link SessionLockTimeout}), so a row held by a foreign transaction fails
 * the claim within that bound.
 */
public class TaskClaimCoordinator {

    private static final Logger log = LoggerFactory.getLogger(TaskClaimCoordinator.class);

    private static final String SERIALIZATION_FAILURE = "40001";
    private static final int H2_CONCURRENT_UPDATE = 90131;

    private final Database db;
    private final QueryBuilder queries;
    private final TaskMapper mapper = new TaskMapper();
    private final EntityDescriptor candidates;
    private final int batchSize;
    private final Duration defaultTimeout;

    public TaskClaimCoordinator(Database db, QueryBuilder queries, int batchSize, Duration defaultTimeout) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.db = db;
        this.queries = queries;
        this.candidates = mapper.descriptor().select(TaskMapper.TASK_ID);
        this.batchSize = batchSize;
        this.defaultTimeout = defaultTimeout;
    }

    public Optional<Task> acquireNextTask(String workerId) {
        return acquireNextTask(workerId, defaultTimeout);
    }

    /**
     * Claim the oldest PENDING task for {@code workerId}.
     *
     * @param timeout bound on each statement and on each row-lock wait of the claim,
     *                null to rely on the store's lock timeout only
     * @return the task in its RUNNING state, empty when nothing is pending
     * @throws ClaimException on any store failure; nothing was claimed
     */
    public Optional<Task> acquireNextTask(String workerId, Duration timeout) {
        try (Connection conn = db.getConnection();
                SessionLockTimeout ignored = SessionLockTimeout.apply(db, conn, timeout)) {
            try {
                Optional<Task> claimed = claim(conn, workerId, timeout);
                conn.commit();

                if (claimed.isPresent()) {
                    log.debug("Claimed task {} for worker {}", claimed.get().taskId(), workerId);
                }
                return claimed;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new ClaimException("Failed to claim a task for worker " + workerId, e);
        }
    }

    private Optional<Task> claim(Connection conn, String workerId, Duration timeout) throws SQLException {
        Predicate pending = Predicate.eq(TaskMapper.STATUS, TaskStatus.PENDING);

        while (true) {
            List<EntityRow> batch = queries.list(conn, candidates, pending, batchSize, timeout);
            if (batch.isEmpty()) {
                return Optional.empty();
            }

            for (EntityRow candidate : batch) {
                int taskId = candidate.getInt(TaskMapper.TASK_ID);
                if (tryClaim(conn, taskId, workerId, timeout)) {
                    EntityRow row = queries.loadByKey(conn, mapper.descriptor(), taskId, timeout);
                    return Optional.of(mapper.fromRow(row));
                }
                log.debug("Task {} taken by another worker, trying next candidate", taskId);
            }
        }
    }

    /**
     * The conditional update. True if this transaction moved the row to RUNNING.
     */
    private boolean tryClaim(Connection conn, int taskId, String workerId, Duration timeout) throws SQLException {
        EntityRow changes = mapper.descriptor().newRow()
                .set(TaskMapper.STATUS, TaskStatus.RUNNING.name())
                .set(TaskMapper.CLAIMED_BY, workerId)
                .set(TaskMapper.CLAIMED_AT, Instant.now());
        Predicate stillPending = Predicate.eq(TaskMapper.TASK_ID, taskId)
                .andEq(TaskMapper.STATUS, TaskStatus.PENDING);

        try {
            return queries.updateWhere(conn, changes, stillPending, timeout) == 1;
        } catch (SQLException e) {
            if (!isSerializationFailure(e)) {
                throw e;
            }
            // Only reads preceded this update, so dropping the transaction loses nothing.
            conn.rollback();
            log.debug("Serialization conflict on task {}, treating as lost race", taskId);
            return false;
        }
    }

    private static boolean isSerializationFailure(SQLException e) {
        return SERIALIZATION_FAILURE.equals(e.getSQLState()) || e.getErrorCode() == H2_CONCURRENT_UPDATE;
    }
}
