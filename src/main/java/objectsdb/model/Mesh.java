package objectsdb.model;

import objectsdb.SchemaException;

import java.util.ArrayList;
import java.util.List;

/**
 * Triangle mesh of an original model. Vertices are stored flat (x0, y0, z0, x1, ...).
 */
public record Mesh(int originalModelId, List<Double> vertices, List<Integer> triangles) {

    public Mesh {
        vertices = List.copyOf(vertices);
        triangles = List.copyOf(triangles);
    }

    /**
     * Regroup the flat vertex list into points.
     *
     * @throws SchemaException if the vertex list is not a multiple of 3
     */
    public MeshShape toShape() {
        if (vertices.size() % 3 != 0) {
            throw new SchemaException("Mesh of original model " + originalModelId
                    + ": size of vertex list (" + vertices.size() + ") is not a multiple of 3");
        }
        List<Point3> points = new ArrayList<>(vertices.size() / 3);
        for (int i = 0; i < vertices.size(); i += 3) {
            points.add(new Point3(vertices.get(i), vertices.get(i + 1), vertices.get(i + 2)));
        }
        return new MeshShape(points, triangles);
    }
}
