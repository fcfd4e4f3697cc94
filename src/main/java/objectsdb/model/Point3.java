package objectsdb.model;

public record Point3(double x, double y, double z) {
}
