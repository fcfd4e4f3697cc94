package objectsdb.model;

import java.util.List;

/**
 * One perturbed execution sample of a grasp.
 */
public record Perturbation(Integer id, int graspId, List<Double> delta, Boolean result) {

    public Perturbation {
        delta = delta == null ? List.of() : List.copyOf(delta);
    }

    public Perturbation withId(int newId) {
        return new Perturbation(newId, graspId, delta, result);
    }
}
