package objectsdb.store.mapping;

import objectsdb.model.Task;
import objectsdb.model.TaskStatus;
import objectsdb.schema.ColumnType;
import objectsdb.schema.EntityDescriptor;
import objectsdb.schema.EntityRow;

public final class TaskMapper implements EntityMapper<Task> {

    public static final String TABLE = "task";
    public static final String TASK_ID = "task_id";
    public static final String TASK_TYPE = "task_type";
    public static final String SCALED_MODEL_ID = "scaled_model_id";
    public static final String HAND_NAME = "hand_name";
    public static final String CONFIG = "task_config";
    public static final String STATUS = "status";
    public static final String CLAIMED_BY = "claimed_by";
    public static final String CLAIMED_AT = "claimed_at";
    public static final String FINISHED_AT = "finished_at";
    public static final String OUTCOME = "task_outcome";

    private static final EntityDescriptor DESCRIPTOR = EntityDescriptor.builder(TABLE)
            .key(TASK_ID, ColumnType.INTEGER)
            .column(TASK_TYPE, ColumnType.TEXT)
            .column(SCALED_MODEL_ID, ColumnType.INTEGER)
            .column(HAND_NAME, ColumnType.TEXT)
            .column(CONFIG, ColumnType.TEXT)
            .column(STATUS, ColumnType.TEXT)
            .column(CLAIMED_BY, ColumnType.TEXT)
            .column(CLAIMED_AT, ColumnType.TIMESTAMP)
            .column(FINISHED_AT, ColumnType.TIMESTAMP)
            .column(OUTCOME, ColumnType.TEXT)
            .build();

    @Override
    public EntityDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Task fromRow(EntityRow row) {
        return Task.builder()
                .taskId(row.getInt(TASK_ID))
                .taskType(row.getString(TASK_TYPE))
                .scaledModelId(row.getInt(SCALED_MODEL_ID))
                .handName(row.getString(HAND_NAME))
                .config(row.getString(CONFIG))
                .status(TaskStatus.valueOf(row.getString(STATUS)))
                .claimedBy(row.getString(CLAIMED_BY))
                .claimedAt(row.getInstant(CLAIMED_AT))
                .finishedAt(row.getInstant(FINISHED_AT))
                .outcome(row.getString(OUTCOME))
                .build();
    }

    @Override
    public EntityRow toRow(Task task) {
        return DESCRIPTOR.newRow()
                .set(TASK_ID, task.taskId())
                .set(TASK_TYPE, task.taskType())
                .set(SCALED_MODEL_ID, task.scaledModelId())
                .set(HAND_NAME, task.handName())
                .set(CONFIG, task.config())
                .set(STATUS, task.status().name())
                .set(CLAIMED_BY, task.claimedBy())
                .set(CLAIMED_AT, task.claimedAt())
                .set(FINISHED_AT, task.finishedAt())
                .set(OUTCOME, task.outcome());
    }
}
