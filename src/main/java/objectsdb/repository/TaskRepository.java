package objectsdb.repository;

import objectsdb.model.Task;
import objectsdb.model.TaskReportResult;
import objectsdb.model.TaskStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the experiment task queue.
 */
public interface TaskRepository {

    /**
     * Queue a new task.
     *
     * @param task the task; its id is used when set, generated otherwise
     * @return the stored task id
     */
    int insert(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(int taskId);

    /**
     * Find tasks by status, oldest first.
     *
     * @param status the status to filter by
     * @return list of tasks
     */
    List<Task> findByStatus(TaskStatus status);

    /**
     * Count tasks by status.
     */
    int countByStatus(TaskStatus status);

    /**
     * Atomically claim the oldest PENDING task for a worker.
     * Moves it from PENDING to RUNNING and records the claimant.
     *
     * @param workerId the worker claiming the task
     * @return the claimed task in its RUNNING state, empty if nothing is pending
     */
    Optional<Task> acquireNextTask(String workerId);

    /**
     * Same as {@link #acquireNextTask(String)}, giving up after {@code timeout}.
     * A claim that times out changes nothing.
     */
    Optional<Task> acquireNextTask(String workerId, Duration timeout);

    /**
     * Report success. Only the worker holding the RUNNING task may do so.
     *
     * @param outcome free-form outcome description, may be null
     */
    TaskReportResult complete(int taskId, String workerId, String outcome);

    /**
     * Report failure. Only the worker holding the RUNNING task may do so.
     */
    TaskReportResult markError(int taskId, String workerId, String outcome);

    /**
     * Administrative recovery: put a RUNNING or ERROR task back to PENDING and
     * clear its claimant. Never called by the claim path itself.
     *
     * @return true if the task was re-queued
     */
    boolean requeue(int taskId);

    /**
     * Put every task that is still RUNNING under a claim made before
     * {@code claimedBefore} back to PENDING, in one conditional update. A task
     * claimed again after the cutoff is left with its new claimant.
     *
     * @return number of tasks re-queued
     */
    int requeueStale(Instant claimedBefore);

    /**
     * RUNNING tasks claimed before the given instant, ordered by task id.
     */
    List<Task> findStaleRunning(Instant claimedBefore);
}
