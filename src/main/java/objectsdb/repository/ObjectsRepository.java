package objectsdb.repository;

import objectsdb.model.Grasp;
import objectsdb.model.Mesh;
import objectsdb.model.MeshShape;
import objectsdb.model.OriginalModel;
import objectsdb.model.Perturbation;
import objectsdb.model.ScaledModel;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the object reference data: models, grasps, meshes and perturbations.
 * Lists come back ordered by id.
 */
public interface ObjectsRepository {

    List<OriginalModel> getOriginalModelsList();

    List<ScaledModel> getScaledModelsList();

    int getNumOriginalModels();

    /**
     * Scaled models whose original model was acquired with the given method.
     */
    List<ScaledModel> getScaledModelsByAcquisition(String acquisitionMethod);

    /**
     * Scaled models whose original model belongs to the named model set.
     *
     * @param modelSetName the set; null or blank means every scaled model
     */
    List<ScaledModel> getScaledModelsBySet(String modelSetName);

    /**
     * Original models carrying every one of the given tags.
     */
    List<OriginalModel> getModelsListByTags(List<String> tags);

    /**
     * The directory geometry paths are relative to, if one is recorded.
     */
    Optional<String> getModelRoot();

    List<Grasp> getGrasps(int scaledModelId, String handName);

    /**
     * Only the grasps marked as cluster representatives.
     */
    List<Grasp> getClusterRepGrasps(int scaledModelId, String handName);

    /**
     * The mesh of the original model behind a scaled model.
     *
     * @throws objectsdb.NotFoundException if the scaled model or its mesh does not exist
     */
    Mesh getScaledModelMesh(int scaledModelId);

    /**
     * Same mesh with its vertices grouped into points.
     *
     * @throws objectsdb.SchemaException if the vertex list is not a multiple of 3
     */
    MeshShape getScaledModelShape(int scaledModelId);

    List<Perturbation> getAllPerturbationsForModel(int scaledModelId);

    List<Perturbation> getPerturbationsForGrasps(List<Integer> graspIds);

    // Loading

    int insertOriginalModel(OriginalModel model);

    int insertScaledModel(ScaledModel model);

    int insertGrasp(Grasp grasp);

    void insertMesh(Mesh mesh);

    int insertPerturbation(Perturbation perturbation);

    void addToModelSet(String modelSetName, int originalModelId);

    /**
     * Insert or overwrite a named variable.
     */
    void setVariable(String name, String value);
}
