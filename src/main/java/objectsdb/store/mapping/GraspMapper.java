package objectsdb.store.mapping;

import objectsdb.model.Grasp;
import objectsdb.schema.ColumnType;
import objectsdb.schema.EntityDescriptor;
import objectsdb.schema.EntityRow;

public final class GraspMapper implements EntityMapper<Grasp> {

    public static final String TABLE = "grasp";
    public static final String ID = "grasp_id";
    public static final String SCALED_MODEL_ID = "scaled_model_id";
    public static final String HAND_NAME = "hand_name";
    public static final String PREGRASP_JOINTS = "grasp_pregrasp_joints";
    public static final String GRASP_JOINTS = "grasp_grasp_joints";
    public static final String ENERGY = "grasp_energy";
    public static final String PREGRASP_POSE = "grasp_pregrasp_position";
    public static final String GRASP_POSE = "grasp_grasp_position";
    public static final String PREGRASP_CLEARANCE = "grasp_pregrasp_clearance";
    public static final String CLUSTER_REP = "grasp_cluster_rep";
    public static final String TABLE_CLEARANCE = "grasp_table_clearance";
    public static final String COMPLIANT_COPY = "grasp_compliant_copy";
    public static final String COMPLIANT_ORIGINAL_ID = "grasp_compliant_original_id";
    public static final String SCALED_QUALITY = "grasp_scaled_quality";

    private static final EntityDescriptor DESCRIPTOR = EntityDescriptor.builder(TABLE)
            .key(ID, ColumnType.INTEGER)
            .column(SCALED_MODEL_ID, ColumnType.INTEGER)
            .column(HAND_NAME, ColumnType.TEXT)
            .column(PREGRASP_JOINTS, ColumnType.DOUBLE_ARRAY)
            .column(GRASP_JOINTS, ColumnType.DOUBLE_ARRAY)
            .column(ENERGY, ColumnType.DOUBLE)
            .column(PREGRASP_POSE, ColumnType.DOUBLE_ARRAY)
            .column(GRASP_POSE, ColumnType.DOUBLE_ARRAY)
            .column(PREGRASP_CLEARANCE, ColumnType.DOUBLE)
            .column(CLUSTER_REP, ColumnType.BOOLEAN)
            .column(TABLE_CLEARANCE, ColumnType.DOUBLE)
            .column(COMPLIANT_COPY, ColumnType.BOOLEAN)
            .column(COMPLIANT_ORIGINAL_ID, ColumnType.INTEGER)
            .column(SCALED_QUALITY, ColumnType.DOUBLE)
            .build();

    @Override
    public EntityDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Grasp fromRow(EntityRow row) {
        return Grasp.builder()
                .id(row.getInt(ID))
                .scaledModelId(row.getInt(SCALED_MODEL_ID))
                .handName(row.getString(HAND_NAME))
                .pregraspJoints(row.getList(PREGRASP_JOINTS))
                .graspJoints(row.getList(GRASP_JOINTS))
                .energy(row.getDouble(ENERGY))
                .pregraspPose(row.getList(PREGRASP_POSE))
                .graspPose(row.getList(GRASP_POSE))
                .pregraspClearance(row.getDouble(PREGRASP_CLEARANCE))
                .clusterRep(Boolean.TRUE.equals(row.getBoolean(CLUSTER_REP)))
                .tableClearance(row.getDouble(TABLE_CLEARANCE))
                .compliantCopy(Boolean.TRUE.equals(row.getBoolean(COMPLIANT_COPY)))
                .compliantOriginalId(row.getInt(COMPLIANT_ORIGINAL_ID))
                .scaledQuality(row.getDouble(SCALED_QUALITY))
                .build();
    }

    @Override
    public EntityRow toRow(Grasp grasp) {
        return DESCRIPTOR.newRow()
                .set(ID, grasp.id())
                .set(SCALED_MODEL_ID, grasp.scaledModelId())
                .set(HAND_NAME, grasp.handName())
                .set(PREGRASP_JOINTS, grasp.pregraspJoints())
                .set(GRASP_JOINTS, grasp.graspJoints())
                .set(ENERGY, grasp.energy())
                .set(PREGRASP_POSE, grasp.pregraspPose())
                .set(GRASP_POSE, grasp.graspPose())
                .set(PREGRASP_CLEARANCE, grasp.pregraspClearance())
                .set(CLUSTER_REP, grasp.clusterRep())
                .set(TABLE_CLEARANCE, grasp.tableClearance())
                .set(COMPLIANT_COPY, grasp.compliantCopy())
                .set(COMPLIANT_ORIGINAL_ID, grasp.compliantOriginalId())
                .set(SCALED_QUALITY, grasp.scaledQuality());
    }
}
