package objectsdb.schema;

import objectsdb.SchemaException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntityRowTest {

    private static final EntityDescriptor GRASP = EntityDescriptor.builder("grasp")
            .key("grasp_id", ColumnType.INTEGER)
            .column("hand_name", ColumnType.TEXT)
            .column("grasp_energy", ColumnType.DOUBLE)
            .column("grasp_cluster_rep", ColumnType.BOOLEAN)
            .column("grasp_grasp_joints", ColumnType.DOUBLE_ARRAY)
            .column("claimed_at", ColumnType.TIMESTAMP)
            .build();

    @Test
    void typedGetters() {
        Instant now = Instant.now();
        EntityRow row = GRASP.newRow()
                .key(7)
                .set("hand_name", "WILLOW_GRIPPER_2010")
                .set("grasp_energy", 12.5)
                .set("grasp_cluster_rep", true)
                .set("grasp_grasp_joints", List.of(0.1, 0.2))
                .set("claimed_at", now);

        assertEquals(7, row.key());
        assertEquals(7, row.getInt("grasp_id"));
        assertEquals("WILLOW_GRIPPER_2010", row.getString("hand_name"));
        assertEquals(12.5, row.getDouble("grasp_energy"));
        assertTrue(row.getBoolean("grasp_cluster_rep"));
        assertEquals(List.of(0.1, 0.2), row.getList("grasp_grasp_joints"));
        assertEquals(now, row.getInstant("claimed_at"));
    }

    @Test
    void unsetValuesAreNull() {
        EntityRow row = GRASP.newRow();

        assertFalse(row.has("hand_name"));
        assertNull(row.get("hand_name"));
        assertNull(row.key());
        assertEquals(List.of(), row.getList("grasp_grasp_joints"));
    }

    @Test
    void nullIsAValue() {
        EntityRow row = GRASP.newRow().set("grasp_energy", null);

        assertTrue(row.has("grasp_energy"));
        assertNull(row.getDouble("grasp_energy"));
    }

    @Test
    void wrongTypeIsRejected() {
        EntityRow row = GRASP.newRow();

        assertThrows(SchemaException.class, () -> row.set("grasp_energy", "high"));
        assertThrows(SchemaException.class, () -> row.set("grasp_id", 7L));
        assertThrows(SchemaException.class, () -> row.set("grasp_grasp_joints", 0.1));
        assertThrows(SchemaException.class, () -> row.set("grasp_grasp_joints", Arrays.asList(0.1, null)));
    }

    @Test
    void unknownColumnIsRejected() {
        EntityRow row = GRASP.newRow();

        assertThrows(SchemaException.class, () -> row.set("status", "PENDING"));
        assertThrows(SchemaException.class, () -> row.get("status"));
    }

    @Test
    void listsAreCopied() {
        List<Double> joints = new ArrayList<>(List.of(1.0, 2.0));
        EntityRow row = GRASP.newRow().set("grasp_grasp_joints", joints);
        joints.add(3.0);

        assertEquals(List.of(1.0, 2.0), row.getList("grasp_grasp_joints"));
        assertThrows(UnsupportedOperationException.class, () -> row.getList("grasp_grasp_joints").add(4.0));
    }

    @Test
    void equalityIsByValue() {
        EntityRow a = GRASP.newRow().key(1).set("hand_name", "h");
        EntityRow b = GRASP.newRow().key(1).set("hand_name", "h");
        EntityRow c = GRASP.newRow().key(2).set("hand_name", "h");

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
    }
}
