package objectsdb.service;

import objectsdb.model.Task;
import objectsdb.model.TaskReportResult;
import objectsdb.model.TaskStatus;
import objectsdb.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Service layer for the experiment queue.
 * Validates worker input and logs lifecycle transitions.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskRepository taskRepository;

    public TaskService(TaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    /**
     * Queue a new PENDING task.
     */
    public int submit(Task task) {
        if (task.status() != TaskStatus.PENDING) {
            throw new IllegalArgumentException("New tasks must be PENDING, got " + task.status());
        }
        int taskId = taskRepository.insert(task);
        log.info("Queued task {} ({})", taskId, task.taskType());
        return taskId;
    }

    /**
     * Claim the next task for a worker.
     *
     * @return the claimed task, empty if the queue has nothing pending
     */
    public Optional<Task> acquireNextTask(String workerId) {
        requireWorker(workerId);

        Optional<Task> task = taskRepository.acquireNextTask(workerId);
        task.ifPresentOrElse(
                t -> log.info("Task {} claimed by worker {}", t.taskId(), workerId),
                () -> log.debug("No pending task for worker {}", workerId));
        return task;
    }

    /**
     * Same as {@link #acquireNextTask(String)} with a bound on how long the claim may wait.
     */
    public Optional<Task> acquireNextTask(String workerId, Duration timeout) {
        requireWorker(workerId);
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }

        Optional<Task> task = taskRepository.acquireNextTask(workerId, timeout);
        task.ifPresent(t -> log.info("Task {} claimed by worker {}", t.taskId(), workerId));
        return task;
    }

    /**
     * Report a task as done. Repeating the report is harmless.
     */
    public TaskReportResult complete(int taskId, String workerId, String outcome) {
        requireWorker(workerId);

        TaskReportResult res = taskRepository.complete(taskId, workerId, outcome);
        logReport(taskId, workerId, TaskStatus.COMPLETE, res);
        return res;
    }

    /**
     * Report a task as failed. The task is not retried automatically.
     */
    public TaskReportResult markError(int taskId, String workerId, String outcome) {
        requireWorker(workerId);

        TaskReportResult res = taskRepository.markError(taskId, workerId, outcome);
        logReport(taskId, workerId, TaskStatus.ERROR, res);
        return res;
    }

    public Optional<Task> findById(int taskId) {
        return taskRepository.findById(taskId);
    }

    public List<Task> findByStatus(TaskStatus status) {
        return taskRepository.findByStatus(status);
    }

    public int countPending() {
        return taskRepository.countByStatus(TaskStatus.PENDING);
    }

    public int countRunning() {
        return taskRepository.countByStatus(TaskStatus.RUNNING);
    }

    /**
     * Put a RUNNING or ERROR task back in the queue.
     */
    public boolean requeue(int taskId) {
        return taskRepository.requeue(taskId);
    }

    /**
     * Administrative recovery after worker crashes: re-queue every task that has
     * been RUNNING for longer than {@code olderThan}. Only runs when called.
     *
     * @return number of tasks re-queued
     */
    public int requeueStale(Duration olderThan) {
        if (olderThan == null || olderThan.isNegative()) {
            throw new IllegalArgumentException("olderThan must not be negative");
        }

        Instant cutoff = Instant.now().minus(olderThan);
        int requeued = taskRepository.requeueStale(cutoff);
        if (requeued > 0) {
            log.warn("Re-queued {} tasks claimed before {}", requeued, cutoff);
        }
        return requeued;
    }

    private static void requireWorker(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId is required");
        }
    }

    private static void logReport(int taskId, String workerId, TaskStatus target, TaskReportResult res) {
        switch (res) {
            case ACCEPTED -> log.info("Task {} marked {} by worker {}", taskId, target, workerId);
            case ALREADY_FINISHED -> log.debug("Task {} already finished (idempotent)", taskId);
            default -> log.warn("Failed to mark task {} {} by worker {} - result: {}", taskId, target, workerId, res);
        }
    }
}
