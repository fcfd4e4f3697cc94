package objectsdb.store.mapping;

import objectsdb.model.Mesh;
import objectsdb.schema.ColumnType;
import objectsdb.schema.EntityDescriptor;
import objectsdb.schema.EntityRow;

/**
 * Meshes are keyed by the original model they belong to; the key is supplied, not generated.
 */
public final class MeshMapper implements EntityMapper<Mesh> {

    public static final String TABLE = "mesh";
    public static final String ORIGINAL_MODEL_ID = "original_model_id";
    public static final String VERTICES = "mesh_vertex_list";
    public static final String TRIANGLES = "mesh_triangle_list";

    private static final EntityDescriptor DESCRIPTOR = EntityDescriptor.builder(TABLE)
            .naturalKey(ORIGINAL_MODEL_ID, ColumnType.INTEGER)
            .column(VERTICES, ColumnType.DOUBLE_ARRAY)
            .column(TRIANGLES, ColumnType.INTEGER_ARRAY)
            .build();

    @Override
    public EntityDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public Mesh fromRow(EntityRow row) {
        return new Mesh(row.getInt(ORIGINAL_MODEL_ID), row.getList(VERTICES), row.getList(TRIANGLES));
    }

    @Override
    public EntityRow toRow(Mesh mesh) {
        return DESCRIPTOR.newRow()
                .set(ORIGINAL_MODEL_ID, mesh.originalModelId())
                .set(VERTICES, mesh.vertices())
                .set(TRIANGLES, mesh.triangles());
    }
}
