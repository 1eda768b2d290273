package gsecars.tomoxrd.model;

/**
 * A named sample position. Empty coordinates keep the axis where it was before the run.
 */
public record CollectionPoint(String name, Double x, Double y, Double z, boolean enabled) {

    public CollectionPoint {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Collection point name cannot be empty");
        }
    }

    public CollectionPoint withEnabled(boolean value) {
        return new CollectionPoint(name, x, y, z, value);
    }
}
