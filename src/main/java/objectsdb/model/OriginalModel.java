package objectsdb.model;

import java.util.List;

/**
 * An object as acquired (scanned or modelled), before any scaling.
 * {@code id} is null until the row is stored.
 */
public record OriginalModel(
        Integer id,
        String maker,
        String model,
        String barcode,
        String description,
        List<String> tags,
        String geometryPath,
        String acquisitionMethod) {

    public OriginalModel {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public OriginalModel withId(int newId) {
        return new OriginalModel(newId, maker, model, barcode, description, tags, geometryPath, acquisitionMethod);
    }
}
