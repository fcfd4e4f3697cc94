package objectsdb.store;

import objectsdb.model.Task;
import objectsdb.model.TaskReportResult;
import objectsdb.model.TaskStatus;
import objectsdb.query.Operator;
import objectsdb.query.Predicate;
import objectsdb.repository.TaskRepository;
import objectsdb.schema.EntityRow;
import objectsdb.store.mapping.TaskMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Task queue on top of {@link QueryBuilder}. Claims go through {@link TaskClaimCoordinator}.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final QueryBuilder queries;
    private final TaskClaimCoordinator coordinator;
    private final TaskMapper mapper = new TaskMapper();

    public JdbcTaskRepository(QueryBuilder queries, TaskClaimCoordinator coordinator) {
        this.queries = queries;
        this.coordinator = coordinator;
    }

    @Override
    public int insert(Task task) {
        Object key = queries.insert(mapper.toRow(task));
        return (Integer) key;
    }

    @Override
    public Optional<Task> findById(int taskId) {
        List<EntityRow> rows = queries.list(mapper.descriptor(), Predicate.eq(TaskMapper.TASK_ID, taskId));
        return rows.isEmpty() ? Optional.empty() : Optional.of(mapper.fromRow(rows.get(0)));
    }

    @Override
    public List<Task> findByStatus(TaskStatus status) {
        return queries.list(mapper.descriptor(), Predicate.eq(TaskMapper.STATUS, status)).stream()
                .map(mapper::fromRow)
                .toList();
    }

    @Override
    public int countByStatus(TaskStatus status) {
        return queries.count(mapper.descriptor(), Predicate.eq(TaskMapper.STATUS, status));
    }

    @Override
    public Optional<Task> acquireNextTask(String workerId) {
        return coordinator.acquireNextTask(workerId);
    }

    @Override
    public Optional<Task> acquireNextTask(String workerId, Duration timeout) {
        return coordinator.acquireNextTask(workerId, timeout);
    }

    @Override
    public TaskReportResult complete(int taskId, String workerId, String outcome) {
        return finish(taskId, workerId, TaskStatus.COMPLETE, outcome);
    }

    @Override
    public TaskReportResult markError(int taskId, String workerId, String outcome) {
        return finish(taskId, workerId, TaskStatus.ERROR, outcome);
    }

    /**
     * RUNNING to COMPLETE/ERROR. The conditional update is the only write; the
     * reads before and after it only pick the result to report.
     */
    private TaskReportResult finish(int taskId, String workerId, TaskStatus target, String outcome) {
        TaskReportResult precheck = classify(findById(taskId), workerId);
        if (precheck != TaskReportResult.ACCEPTED) {
            if (precheck == TaskReportResult.WRONG_WORKER) {
                log.warn("Worker {} tried to finish task {} held by another worker", workerId, taskId);
            }
            return precheck;
        }

        EntityRow changes = mapper.descriptor().newRow()
                .set(TaskMapper.STATUS, target.name())
                .set(TaskMapper.FINISHED_AT, Instant.now())
                .set(TaskMapper.OUTCOME, outcome);
        Predicate heldByWorker = Predicate.eq(TaskMapper.TASK_ID, taskId)
                .andEq(TaskMapper.STATUS, TaskStatus.RUNNING)
                .andEq(TaskMapper.CLAIMED_BY, workerId);

        if (queries.updateWhere(changes, heldByWorker) == 1) {
            return TaskReportResult.ACCEPTED;
        }

        // Changed between the read and the update (requeued or reported twice).
        TaskReportResult now = classify(findById(taskId), workerId);
        return now == TaskReportResult.ACCEPTED ? TaskReportResult.ALREADY_FINISHED : now;
    }

    private static TaskReportResult classify(Optional<Task> found, String workerId) {
        if (found.isEmpty()) {
            return TaskReportResult.NOT_FOUND;
        }
        Task task = found.get();
        if (task.isFinished()) {
            return TaskReportResult.ALREADY_FINISHED;
        }
        if (task.status() != TaskStatus.RUNNING) {
            return TaskReportResult.NOT_RUNNING;
        }
        if (!task.isClaimedBy(workerId)) {
            return TaskReportResult.WRONG_WORKER;
        }
        return TaskReportResult.ACCEPTED;
    }

    @Override
    public boolean requeue(int taskId) {
        Predicate requeueable = Predicate.eq(TaskMapper.TASK_ID, taskId)
                .andIn(TaskMapper.STATUS, List.of(TaskStatus.RUNNING, TaskStatus.ERROR));

        boolean requeued = queries.updateWhere(pendingAgain(), requeueable) == 1;
        if (requeued) {
            log.info("Task {} re-queued", taskId);
        }
        return requeued;
    }

    @Override
    public int requeueStale(Instant claimedBefore) {
        // Same condition as findStaleRunning, evaluated by the update itself.
        int requeued = queries.updateWhere(pendingAgain(), staleRunning(claimedBefore));
        if (requeued > 0) {
            log.info("{} tasks claimed before {} re-queued", requeued, claimedBefore);
        }
        return requeued;
    }

    @Override
    public List<Task> findStaleRunning(Instant claimedBefore) {
        return queries.list(mapper.descriptor(), staleRunning(claimedBefore)).stream()
                .map(mapper::fromRow)
                .toList();
    }

    private static Predicate staleRunning(Instant claimedBefore) {
        return Predicate.eq(TaskMapper.STATUS, TaskStatus.RUNNING)
                .and(TaskMapper.CLAIMED_AT, Operator.LT, claimedBefore);
    }

    private EntityRow pendingAgain() {
        return mapper.descriptor().newRow()
                .set(TaskMapper.STATUS, TaskStatus.PENDING.name())
                .set(TaskMapper.CLAIMED_BY, null)
                .set(TaskMapper.CLAIMED_AT, null)
                .set(TaskMapper.FINISHED_AT, null)
                .set(TaskMapper.OUTCOME, null);
    }
}
