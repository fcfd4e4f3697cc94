package objectsdb.model;

import java.util.List;

/**
 * Mesh as points plus triangle indices into the point list.
 */
public record MeshShape(List<Point3> vertices, List<Integer> triangles) {

    public MeshShape {
        vertices = List.copyOf(vertices);
        triangles = List.copyOf(triangles);
    }
}
