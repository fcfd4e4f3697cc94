package objectsdb.service;

import objectsdb.model.Grasp;
import objectsdb.model.Mesh;
import objectsdb.model.MeshShape;
import objectsdb.model.OriginalModel;
import objectsdb.model.Perturbation;
import objectsdb.model.ScaledModel;
import objectsdb.repository.ObjectsRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Service layer for object reference data.
 * Validates lookups and resolves geometry files against the model root.
 */
public class ObjectsService {

    private static final Logger log = LoggerFactory.getLogger(ObjectsService.class);

    private final ObjectsRepository objectsRepository;

    public ObjectsService(ObjectsRepository objectsRepository) {
        this.objectsRepository = objectsRepository;
    }

    public List<OriginalModel> getOriginalModels() {
        return objectsRepository.getOriginalModelsList();
    }

    public int countOriginalModels() {
        return objectsRepository.getNumOriginalModels();
    }

    public List<ScaledModel> getScaledModels() {
        return objectsRepository.getScaledModelsList();
    }

    public List<ScaledModel> getScaledModelsByAcquisition(String acquisitionMethod) {
        if (acquisitionMethod == null || acquisitionMethod.isBlank()) {
            throw new IllegalArgumentException("acquisitionMethod is required");
        }
        return objectsRepository.getScaledModelsByAcquisition(acquisitionMethod);
    }

    /**
     * @param modelSetName the set, or blank for every scaled model
     */
    public List<ScaledModel> getScaledModelsBySet(String modelSetName) {
        return objectsRepository.getScaledModelsBySet(modelSetName);
    }

    public List<OriginalModel> getModelsByTags(List<String> tags) {
        Objects.requireNonNull(tags, "tags");
        for (String tag : tags) {
            if (tag == null || tag.isBlank()) {
                throw new IllegalArgumentException("tags must not be blank");
            }
        }
        return objectsRepository.getModelsListByTags(tags);
    }

    public List<Grasp> getGrasps(int scaledModelId, String handName, boolean clusterRepsOnly) {
        if (handName == null || handName.isBlank()) {
            throw new IllegalArgumentException("handName is required");
        }
        return clusterRepsOnly
                ? objectsRepository.getClusterRepGrasps(scaledModelId, handName)
                : objectsRepository.getGrasps(scaledModelId, handName);
    }

    public Mesh getMesh(int scaledModelId) {
        return objectsRepository.getScaledModelMesh(scaledModelId);
    }

    public MeshShape getShape(int scaledModelId) {
        return objectsRepository.getScaledModelShape(scaledModelId);
    }

    public List<Perturbation> getPerturbations(int scaledModelId) {
        return objectsRepository.getAllPerturbationsForModel(scaledModelId);
    }

    public List<Perturbation> getPerturbations(List<Integer> graspIds) {
        return objectsRepository.getPerturbationsForGrasps(graspIds);
    }

    /**
     * Absolute location of a model's geometry file. Relative geometry paths are
     * resolved against the recorded model root.
     *
     * @return empty if the model has no geometry path, or it is relative and no root is recorded
     */
    public Optional<Path> resolveGeometryPath(OriginalModel model) {
        if (model.geometryPath() == null || model.geometryPath().isBlank()) {
            return Optional.empty();
        }
        Path geometry = Path.of(model.geometryPath());
        if (geometry.isAbsolute()) {
            return Optional.of(geometry);
        }

        Optional<String> root = objectsRepository.getModelRoot();
        if (root.isEmpty()) {
            log.warn("No model root recorded, cannot resolve geometry of model {}", model.id());
        }
        return root.map(r -> Path.of(r).resolve(geometry));
    }
}
