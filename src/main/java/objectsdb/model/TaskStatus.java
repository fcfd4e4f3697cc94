package objectsdb.model;

/**
 * Experiment task status.
 */
public enum TaskStatus {
    /** Task queued, waiting to be claimed */
    PENDING,
    /** Task claimed by a worker and being executed */
    RUNNING,
    /** Worker reported success */
    COMPLETE,
    /** Worker reported failure */
    ERROR
}
