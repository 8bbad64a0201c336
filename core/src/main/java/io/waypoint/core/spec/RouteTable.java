package io.waypoint.core.spec;

import io.waypoint.core.model.RouteDefinition;
import java.util.List;
import java.util.Objects;

/**
 * A parsed route table file.
 *
 * @param source  file path or label the table was read from
 * @param groups  declared groups, in match order
 * @param entries top-level routes with their target group
 */
public record RouteTable(String source, List<String> groups, List<Entry> entries) {

    public RouteTable {
        groups = List.copyOf(groups);
        entries = List.copyOf(entries);
    }

    /** A top-level route and the group it is registered in. */
    public record Entry(String group, RouteDefinition definition) {

        public Entry {
            Objects.requireNonNull(group, "group must not be null");
            Objects.requireNonNull(definition, "definition must not be null");
        }
    }
}
