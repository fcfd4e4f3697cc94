package objectsdb.store.mapping;

import objectsdb.model.Perturbation;
import objectsdb.schema.ColumnType;
import objectsdb.schema.EntityDescriptor;
import objectsdb.schema.EntityRow;

public final class PerturbationMapper implements EntityMapper<Perturbation> {

    public static final String TABLE = "perturbation";
    public static final String ID = "perturbation_id";
    public static final String GRASP_ID = "grasp_id";
    public static final String DELTA = "perturbation_delta";
    public static final String RESULT = "perturbation_result";

    private static final EntityDescriptor DESCRIPTOR = EntityDescriptor.builder(TABLE)
            .key(ID, ColumnType.INTEGER)
            .column(GRASP_ID, ColumnType.INTEGER)
            .column(DELTA, ColumnType.DOUBLE_ARRAY)
            .column(RESULT, ColumnType.BOOLEAN)
            .build();

    @Override
    public EntityDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Perturbation fromRow(EntityRow row) {
        return new Perturbation(row.getInt(ID), row.getInt(GRASP_ID), row.getList(DELTA), row.getBoolean(RESULT));
    }

    @Override
    public EntityRow toRow(Perturbation perturbation) {
        return DESCRIPTOR.newRow()
                .set(ID, perturbation.id())
                .set(GRASP_ID, perturbation.graspId())
                .set(DELTA, perturbation.delta())
                .set(RESULT, perturbation.result());
    }
}
