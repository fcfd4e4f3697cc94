package objectsdb.model;

/**
 * A scaled instance of an original model; grasps are planned against these.
 */
public record ScaledModel(Integer id, int originalModelId, double scale) {

    public ScaledModel withId(int newId) {
        return new ScaledModel(newId, originalModelId, scale);
    }
}
