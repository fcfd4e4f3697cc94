package objectsdb.model;

/**
 * Outcome of a worker reporting the end of a task.
 */
public enum TaskReportResult {
    /** Task moved from RUNNING to COMPLETE or ERROR */
    ACCEPTED,

    /** Task was already COMPLETE or ERROR - idempotent success */
    ALREADY_FINISHED,

    /** Task not found */
    NOT_FOUND,

    /** Task is claimed by a different worker */
    WRONG_WORKER,

    /** Task is still PENDING, nobody claimed it */
    NOT_RUNNING
}
