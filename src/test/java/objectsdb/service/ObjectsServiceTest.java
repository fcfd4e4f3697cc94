package objectsdb.service;

import objectsdb.H2Databases;
import objectsdb.config.Dependencies;
import objectsdb.model.Grasp;
import objectsdb.model.OriginalModel;
import objectsdb.model.ScaledModel;
import objectsdb.repository.ObjectsRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ObjectsServiceTest {

    private Dependencies deps;
    private ObjectsRepository repo;
    private ObjectsService service;

    @BeforeEach
    void setup() {
        deps = Dependencies.create(H2Databases.config("objects-service"));
        repo = deps.objectsRepository();
        service = deps.objectsService();
    }

    @AfterEach
    void teardown() {
        if (deps != null)
            deps.close();
    }

    @Test
    void geometryPathResolution() {
        OriginalModel relative = model("ikea/mug.ply");
        OriginalModel absolute = model("/data/soup.ply");

        assertEquals(Path.of("/data/soup.ply"), service.resolveGeometryPath(absolute).orElseThrow());
        assertTrue(service.resolveGeometryPath(relative).isEmpty());
        assertTrue(service.resolveGeometryPath(model(null)).isEmpty());

        repo.setVariable("MODEL_ROOT", "/mnt/models");
        assertEquals(Path.of("/mnt/models/ikea/mug.ply"), service.resolveGeometryPath(relative).orElseThrow());
    }

    @Test
    void graspLookupSelectsClusterReps() {
        int original = repo.insertOriginalModel(model("ikea/mug.ply"));
        int scaled = repo.insertScaledModel(new ScaledModel(null, original, 1.0));
        repo.insertGrasp(Grasp.builder().scaledModelId(scaled).handName("HAND").clusterRep(true).build());
        repo.insertGrasp(Grasp.builder().scaledModelId(scaled).handName("HAND").clusterRep(false).build());

        assertEquals(2, service.getGrasps(scaled, "HAND", false).size());
        assertEquals(1, service.getGrasps(scaled, "HAND", true).size());
        assertThrows(IllegalArgumentException.class, () -> service.getGrasps(scaled, " ", false));
    }

    @Test
    void lookupsValidateArguments() {
        assertThrows(IllegalArgumentException.class, () -> service.getScaledModelsByAcquisition(""));
        assertThrows(IllegalArgumentException.class, () -> service.getModelsByTags(Arrays.asList("mug", null)));
        assertThrows(NullPointerException.class, () -> service.getModelsByTags(null));
    }

    @Test
    void countsAndLists() {
        int original = repo.insertOriginalModel(model("ikea/mug.ply"));
        repo.insertScaledModel(new ScaledModel(null, original, 1.0));

        assertEquals(1, service.countOriginalModels());
        assertEquals(1, service.getOriginalModels().size());
        assertEquals(1, service.getScaledModels().size());
        assertEquals(1, service.getScaledModelsByAcquisition("3D_SCAN").size());
        assertEquals(1, service.getModelsByTags(List.of("mug")).size());
    }

    private static OriginalModel model(String geometryPath) {
        return new OriginalModel(null, "Ikea", "Mug", null, null, List.of("mug"), geometryPath, "3D_SCAN");
    }
}
