package objectsdb.model;

import objectsdb.SchemaException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MeshTest {

    @Test
    void verticesAreGroupedIntoPoints() {
        Mesh mesh = new Mesh(4, List.of(0.0, 0.0, 0.0, 1.0, 0.0, 0.0, 0.0, 1.0, 0.5), List.of(0, 1, 2));

        MeshShape shape = mesh.toShape();

        assertEquals(3, shape.vertices().size());
        assertEquals(new Point3(1.0, 0.0, 0.0), shape.vertices().get(1));
        assertEquals(new Point3(0.0, 1.0, 0.5), shape.vertices().get(2));
        assertEquals(List.of(0, 1, 2), shape.triangles());
    }

    @Test
    void emptyMesh() {
        MeshShape shape = new Mesh(4, List.of(), List.of()).toShape();

        assertTrue(shape.vertices().isEmpty());
        assertTrue(shape.triangles().isEmpty());
    }

    @Test
    void vertexListMustBeMultipleOfThree() {
        Mesh broken = new Mesh(4, List.of(0.0, 1.0, 2.0, 3.0), List.of());

        SchemaException e = assertThrows(SchemaException.class, broken::toShape);
        assertTrue(e.getMessage().contains("multiple of 3"));
    }
}
