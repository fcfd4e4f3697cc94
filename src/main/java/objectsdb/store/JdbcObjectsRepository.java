package objectsdb.store;

import objectsdb.QueryException;
import objectsdb.model.Grasp;
import objectsdb.model.Mesh;
import objectsdb.model.MeshShape;
import objectsdb.model.OriginalModel;
import objectsdb.model.Perturbation;
import objectsdb.model.ScaledModel;
import objectsdb.query.Predicate;
import objectsdb.repository.ObjectsRepository;
import objectsdb.schema.ColumnType;
import objectsdb.schema.EntityDescriptor;
import objectsdb.schema.EntityRow;
import objectsdb.store.mapping.EntityMapper;
import objectsdb.store.mapping.GraspMapper;
import objectsdb.store.mapping.MeshMapper;
import objectsdb.store.mapping.OriginalModelMapper;
import objectsdb.store.mapping.PerturbationMapper;
import objectsdb.store.mapping.ScaledModelMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Object reference data on top of {@link QueryBuilder}. Every filter is a
 * structured {@link Predicate}, so caller-supplied names and tags are always bound.
 */
public class JdbcObjectsRepository implements ObjectsRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcObjectsRepository.class);

    static final String MODEL_SET_TABLE = "model_set";
    static final String MODEL_SET_NAME = "model_set_name";
    static final String VARIABLE_TABLE = "variable";
    static final String VARIABLE_NAME = "variable_name";
    static final String VARIABLE_VALUE = "variable_value";
    static final String MODEL_ROOT = "MODEL_ROOT";

    private static final String UNIQUE_VIOLATION = "23505";

    private static final EntityDescriptor MODEL_SET = EntityDescriptor.builder(MODEL_SET_TABLE)
            .column(MODEL_SET_NAME, ColumnType.TEXT)
            .column(ScaledModelMapper.ORIGINAL_MODEL_ID, ColumnType.INTEGER)
            .build();

    private static final EntityDescriptor VARIABLE = EntityDescriptor.builder(VARIABLE_TABLE)
            .naturalKey(VARIABLE_NAME, ColumnType.TEXT)
            .column(VARIABLE_VALUE, ColumnType.TEXT)
            .build();

    private final QueryBuilder queries;
    private final OriginalModelMapper originalModels = new OriginalModelMapper();
    private final ScaledModelMapper scaledModels = new ScaledModelMapper();
    private final GraspMapper grasps = new GraspMapper();
    private final MeshMapper meshes = new MeshMapper();
    private final PerturbationMapper perturbations = new PerturbationMapper();

    public JdbcObjectsRepository(QueryBuilder queries) {
        this.queries = queries;
    }

    @Override
    public List<OriginalModel> getOriginalModelsList() {
        return list(originalModels, Predicate.all());
    }

    @Override
    public List<ScaledModel> getScaledModelsList() {
        return list(scaledModels, Predicate.all());
    }

    @Override
    public int getNumOriginalModels() {
        return queries.count(originalModels.descriptor(), Predicate.all());
    }

    @Override
    public List<ScaledModel> getScaledModelsByAcquisition(String acquisitionMethod) {
        Predicate acquiredWith = Predicate.inSelect(ScaledModelMapper.ORIGINAL_MODEL_ID,
                OriginalModelMapper.TABLE, OriginalModelMapper.ID,
                Predicate.eq(OriginalModelMapper.ACQUISITION_METHOD, acquisitionMethod));
        return list(scaledModels, acquiredWith);
    }

    @Override
    public List<ScaledModel> getScaledModelsBySet(String modelSetName) {
        if (modelSetName == null || modelSetName.isBlank()) {
            return getScaledModelsList();
        }
        Predicate inSet = Predicate.inSelect(ScaledModelMapper.ORIGINAL_MODEL_ID,
                MODEL_SET_TABLE, ScaledModelMapper.ORIGINAL_MODEL_ID,
                Predicate.eq(MODEL_SET_NAME, modelSetName));
        return list(scaledModels, inSet);
    }

    @Override
    public List<OriginalModel> getModelsListByTags(List<String> tags) {
        Predicate tagged = Predicate.all();
        for (String tag : tags) {
            tagged = tagged.andContains(OriginalModelMapper.TAGS, tag);
        }
        return list(originalModels, tagged);
    }

    @Override
    public Optional<String> getModelRoot() {
        List<EntityRow> rows = queries.list(VARIABLE, Predicate.eq(VARIABLE_NAME, MODEL_ROOT));
        if (rows.isEmpty()) {
            log.debug("No {} variable recorded", MODEL_ROOT);
            return Optional.empty();
        }
        return Optional.ofNullable(rows.get(0).getString(VARIABLE_VALUE));
    }

    @Override
    public List<Grasp> getGrasps(int scaledModelId, String handName) {
        return list(grasps, graspsOf(scaledModelId, handName));
    }

    @Override
    public List<Grasp> getClusterRepGrasps(int scaledModelId, String handName) {
        return list(grasps, graspsOf(scaledModelId, handName).andEq(GraspMapper.CLUSTER_REP, true));
    }

    @Override
    public Mesh getScaledModelMesh(int scaledModelId) {
        EntityDescriptor originalIdOnly = scaledModels.descriptor().select(ScaledModelMapper.ORIGINAL_MODEL_ID);
        int originalModelId = queries.loadByKey(originalIdOnly, scaledModelId)
                .getInt(ScaledModelMapper.ORIGINAL_MODEL_ID);

        log.debug("Scaled model {} resolved to original model {}", scaledModelId, originalModelId);
        return meshes.fromRow(queries.loadByKey(meshes.descriptor(), originalModelId));
    }

    @Override
    public MeshShape getScaledModelShape(int scaledModelId) {
        return getScaledModelMesh(scaledModelId).toShape();
    }

    @Override
    public List<Perturbation> getAllPerturbationsForModel(int scaledModelId) {
        Predicate ofModel = Predicate.inSelect(PerturbationMapper.GRASP_ID,
                GraspMapper.TABLE, GraspMapper.ID,
                Predicate.eq(GraspMapper.SCALED_MODEL_ID, scaledModelId));
        return list(perturbations, ofModel);
    }

    @Override
    public List<Perturbation> getPerturbationsForGrasps(List<Integer> graspIds) {
        return list(perturbations, Predicate.in(PerturbationMapper.GRASP_ID, graspIds));
    }

    @Override
    public int insertOriginalModel(OriginalModel model) {
        return (Integer) queries.insert(originalModels.toRow(model));
    }

    @Override
    public int insertScaledModel(ScaledModel model) {
        return (Integer) queries.insert(scaledModels.toRow(model));
    }

    @Override
    public int insertGrasp(Grasp grasp) {
        return (Integer) queries.insert(grasps.toRow(grasp));
    }

    @Override
    public void insertMesh(Mesh mesh) {
        queries.insert(meshes.toRow(mesh));
    }

    @Override
    public int insertPerturbation(Perturbation perturbation) {
        return (Integer) queries.insert(perturbations.toRow(perturbation));
    }

    @Override
    public void addToModelSet(String modelSetName, int originalModelId) {
        queries.insert(MODEL_SET.newRow()
                .set(MODEL_SET_NAME, modelSetName)
                .set(ScaledModelMapper.ORIGINAL_MODEL_ID, originalModelId));
    }

    @Override
    public void setVariable(String name, String value) {
        EntityRow row = VARIABLE.newRow()
                .set(VARIABLE_NAME, name)
                .set(VARIABLE_VALUE, value);
        if (queries.update(row) > 0) {
            return;
        }
        try {
            queries.insert(row);
        } catch (QueryException e) {
            if (!isUniqueViolation(e)) {
                throw e;
            }
            // Another caller inserted the same name after our update; its row exists now.
            log.debug("Variable {} inserted concurrently, updating instead", name);
            queries.update(row);
        }
    }

    // Helper methods

    private static Predicate graspsOf(int scaledModelId, String handName) {
        return Predicate.eq(GraspMapper.SCALED_MODEL_ID, scaledModelId)
                .andEq(GraspMapper.HAND_NAME, handName);
    }

    private static boolean isUniqueViolation(QueryException e) {
        return e.getCause() instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState());
    }

    private <T> List<T> list(EntityMapper<T> mapper, Predicate where) {
        return queries.list(mapper.descriptor(), where).stream()
                .map(mapper::fromRow)
                .toList();
    }
}
