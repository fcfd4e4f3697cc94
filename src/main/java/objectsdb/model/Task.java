package objectsdb.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable experiment task, one row of the shared task queue.
 * {@code taskId} is null until the task has been stored.
 */
public final class Task {
    private final Integer taskId;
    private final String taskType;
    private final Integer scaledModelId;
    private final String handName;
    private final String config; // opaque to the queue, interpreted by workers
    private final TaskStatus status;
    private final String claimedBy; // worker id or null
    private final Instant claimedAt;
    private final Instant finishedAt;
    private final String outcome;

    private Task(Builder builder) {
        this.taskId = builder.taskId;
        this.taskType = builder.taskType;
        this.scaledModelId = builder.scaledModelId;
        this.handName = builder.handName;
        this.config = builder.config;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.claimedBy = builder.claimedBy;
        this.claimedAt = builder.claimedAt;
        this.finishedAt = builder.finishedAt;
        this.outcome = builder.outcome;
    }

    // Getters
    public Integer taskId() {
        return taskId;
    }

    public String taskType() {
        return taskType;
    }

    public Integer scaledModelId() {
        return scaledModelId;
    }

    public String handName() {
        return handName;
    }

    public String config() {
        return config;
    }

    public TaskStatus status() {
        return status;
    }

    public String claimedBy() {
        return claimedBy;
    }

    public Instant claimedAt() {
        return claimedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    public String outcome() {
        return outcome;
    }

    /** Check if a worker has reported on this task */
    public boolean isFinished() {
        return status == TaskStatus.COMPLETE || status == TaskStatus.ERROR;
    }

    /** Check if the given worker holds this task */
    public boolean isClaimedBy(String workerId) {
        return status == TaskStatus.RUNNING && Objects.equals(claimedBy, workerId);
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .taskId(taskId)
                .taskType(taskType)
                .scaledModelId(scaledModelId)
                .handName(handName)
                .config(config)
                .status(status)
                .claimedBy(claimedBy)
                .claimedAt(claimedAt)
                .finishedAt(finishedAt)
                .outcome(outcome);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Integer taskId;
        private String taskType;
        private Integer scaledModelId;
        private String handName;
        private String config;
        private TaskStatus status = TaskStatus.PENDING;
        private String claimedBy;
        private Instant claimedAt;
        private Instant finishedAt;
        private String outcome;

        public Builder taskId(Integer taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder taskType(String taskType) {
            this.taskType = taskType;
            return this;
        }

        public Builder scaledModelId(Integer scaledModelId) {
            this.scaledModelId = scaledModelId;
            return this;
        }

        public Builder handName(String handName) {
            this.handName = handName;
            return this;
        }

        public Builder config(String config) {
            this.config = config;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder claimedBy(String claimedBy) {
            this.claimedBy = claimedBy;
            return this;
        }

        public Builder claimedAt(Instant claimedAt) {
            this.claimedAt = claimedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder outcome(String outcome) {
            this.outcome = outcome;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return taskId != null && Objects.equals(taskId, task.taskId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(taskId);
    }

    @Override
    public String toString() {
        return "Task{id=" + taskId + ", type='" + taskType + "', status=" + status + ", claimedBy='" + claimedBy + "'}";
    }
}
