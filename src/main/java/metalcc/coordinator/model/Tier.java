package metalcc.coordinator.model;

import java.util.Objects;

/**
 * A named resource shape with the credits it burns per minute.
 */
public record Tier(String id, String name, ResourceShape shape, long cost) {

    public Tier {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(shape, "shape is required");
    }
}
