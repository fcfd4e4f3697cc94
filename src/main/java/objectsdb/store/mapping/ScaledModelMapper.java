package objectsdb.store.mapping;

import objectsdb.model.ScaledModel;
import objectsdb.schema.ColumnType;
import objectsdb.schema.EntityDescriptor;
import objectsdb.schema.EntityRow;

public final class ScaledModelMapper implements EntityMapper<ScaledModel> {

    public static final String TABLE = "scaled_model";
    public static final String ID = "scaled_model_id";
    public static final String ORIGINAL_MODEL_ID = "original_model_id";
    public static final String SCALE = "scaled_model_scale";

    private static final EntityDescriptor DESCRIPTOR = EntityDescriptor.builder(TABLE)
            .key(ID, ColumnType.INTEGER)
            .column(ORIGINAL_MODEL_ID, ColumnType.INTEGER)
            .column(SCALE, ColumnType.DOUBLE)
            .build();

    @Override
    public EntityDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public ScaledModel fromRow(EntityRow row) {
        Double scale = row.getDouble(SCALE);
        return new ScaledModel(row.getInt(ID), row.getInt(ORIGINAL_MODEL_ID), scale != null ? scale : 1.0);
    }

    @Override
    public EntityRow toRow(ScaledModel model) {
        return DESCRIPTOR.newRow()
                .set(ID, model.id())
                .set(ORIGINAL_MODEL_ID, model.originalModelId())
                .set(SCALE, model.scale());
    }
}
