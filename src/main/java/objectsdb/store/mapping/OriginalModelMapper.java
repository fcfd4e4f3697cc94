package objectsdb.store.mapping;

import objectsdb.model.OriginalModel;
import objectsdb.schema.ColumnType;
import objectsdb.schema.EntityDescriptor;
import objectsdb.schema.EntityRow;

public final class OriginalModelMapper implements EntityMapper<OriginalModel> {

    public static final String TABLE = "original_model";
    public static final String ID = "original_model_id";
    public static final String MAKER = "original_model_maker";
    public static final String MODEL = "original_model_model";
    public static final String BARCODE = "original_model_barcode";
    public static final String DESCRIPTION = "original_model_description";
    public static final String TAGS = "original_model_tags";
    public static final String GEOMETRY_PATH = "original_model_geometry_path";
    public static final String ACQUISITION_METHOD = "acquisition_method_name";

    private static final EntityDescriptor DESCRIPTOR = EntityDescriptor.builder(TABLE)
            .key(ID, ColumnType.INTEGER)
            .column(MAKER, ColumnType.TEXT)
            .column(MODEL, ColumnType.TEXT)
            .column(BARCODE, ColumnType.TEXT)
            .column(DESCRIPTION, ColumnType.TEXT)
            .column(TAGS, ColumnType.TEXT_ARRAY)
            .column(GEOMETRY_PATH, ColumnType.TEXT)
            .column(ACQUISITION_METHOD, ColumnType.TEXT)
            .build();

    @Override
    public EntityDescriptor descriptor() {
        return DESCRIPTOR;
    }

    @Override
    public OriginalModel fromRow(EntityRow row) {
        return new OriginalModel(
                row.getInt(ID),
                row.getString(MAKER),
                row.getString(MODEL),
                row.getString(BARCODE),
                row.getString(DESCRIPTION),
                row.getList(TAGS),
                row.getString(GEOMETRY_PATH),
                row.getString(ACQUISITION_METHOD));
    }

    @Override
    public EntityRow toRow(OriginalModel model) {
        return DESCRIPTOR.newRow()
                .set(ID, model.id())
                .set(MAKER, model.maker())
                .set(MODEL, model.model())
                .set(BARCODE, model.barcode())
                .set(DESCRIPTION, model.description())
                .set(TAGS, model.tags())
                .set(GEOMETRY_PATH, model.geometryPath())
                .set(ACQUISITION_METHOD, model.acquisitionMethod());
    }
}
