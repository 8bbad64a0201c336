package io.waypoint.core.spi;

import java.util.Map;
import java.util.Objects;

/**
 * Opaque description of a loaded view component. The core stores loaders but never invokes them.
 *
 * @param name       component name
 * @param attributes free-form host attributes
 */
public record ComponentDescriptor(String name, Map<String, Object> attributes) {

    public ComponentDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
