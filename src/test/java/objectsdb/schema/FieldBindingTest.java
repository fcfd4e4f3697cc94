package objectsdb.schema;

import objectsdb.SchemaException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FieldBindingTest {

    @Test
    void plainColumnIsReadAndWritten() {
        FieldBinding binding = FieldBinding.of("maker", ColumnType.TEXT);

        assertEquals("maker", binding.column());
        assertEquals(ColumnType.TEXT, binding.type());
        assertTrue(binding.isReadable());
        assertTrue(binding.isWritable());
        assertFalse(binding.isPrimaryKey());
    }

    @Test
    void keyIsReadableButNotWritable() {
        FieldBinding key = FieldBinding.key("id", ColumnType.INTEGER);

        assertTrue(key.isPrimaryKey());
        assertTrue(key.isReadable());
        assertFalse(key.isWritable());
    }

    @Test
    void markingPrimaryKeyImpliesReadable() {
        FieldBinding hidden = FieldBinding.of("id", ColumnType.INTEGER).withReadable(false);
        assertFalse(hidden.isReadable());

        FieldBinding key = hidden.markPrimaryKey();
        assertTrue(key.isPrimaryKey());
        assertTrue(key.isReadable());
        assertTrue(key.isWritable());
    }

    @Test
    void keyStaysReadable() {
        FieldBinding key = FieldBinding.key("id", ColumnType.INTEGER).withReadable(false);
        assertTrue(key.isReadable());
    }

    @Test
    void markMethodsReturnNewBindings() {
        FieldBinding original = FieldBinding.of("energy", ColumnType.DOUBLE).withWritable(false);
        FieldBinding writable = original.markWritable();

        assertNotSame(original, writable);
        assertFalse(original.isWritable());
        assertTrue(writable.isWritable());
        assertEquals(FieldBinding.of("energy", ColumnType.DOUBLE), writable);
    }

    @Test
    void rejectsUnsafeColumnNames() {
        assertThrows(SchemaException.class, () -> FieldBinding.of("bad name", ColumnType.TEXT));
        assertThrows(SchemaException.class, () -> FieldBinding.of("x; DROP TABLE task", ColumnType.TEXT));
        assertThrows(SchemaException.class, () -> FieldBinding.of("", ColumnType.TEXT));
        assertThrows(SchemaException.class, () -> FieldBinding.of(null, ColumnType.TEXT));
    }

    @Test
    void identifierCheck() {
        assertTrue(FieldBinding.isIdentifier("original_model_id"));
        assertTrue(FieldBinding.isIdentifier("_x1"));
        assertFalse(FieldBinding.isIdentifier("1x"));
        assertFalse(FieldBinding.isIdentifier("a.b"));
        assertFalse(FieldBinding.isIdentifier(null));
    }
}
