package io.waypoint.core.model;

import io.waypoint.core.navigation.NavigationGuard;
import io.waypoint.core.pattern.CompiledPattern;
import io.waypoint.core.spi.ComponentLoader;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized registration entry. Records live in the matcher registry's arena and refer to each other by
 * id only, so parent/child and alias relations never form object cycles.
 *
 * @param id          arena id, unique per registry
 * @param group       route group (trie) owning this record
 * @param pattern     compiled absolute pattern
 * @param name        route name, or {@code null}
 * @param parentId    id of the parent record, or {@code null} for a root record
 * @param aliasOf     id of the record this one is an alias of, or {@code null}
 * @param meta        opaque metadata bag
 * @param component   opaque component loader, or {@code null}
 * @param redirect    redirect applied when this record is the matched leaf, or {@code null}
 * @param beforeEnter guards run when this record is entered
 * @param beforeLeave guards run when this record is left
 */
public record RouteRecord(
        long id,
        String group,
        CompiledPattern pattern,
        String name,
        Long parentId,
        Long aliasOf,
        Map<String, Object> meta,
        ComponentLoader component,
        RouteRedirect redirect,
        List<NavigationGuard> beforeEnter,
        List<NavigationGuard> beforeLeave) {

    public RouteRecord {
        Objects.requireNonNull(group, "group must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
        meta = meta == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(meta));
        beforeEnter = beforeEnter == null ? List.of() : List.copyOf(beforeEnter);
        beforeLeave = beforeLeave == null ? List.of() : List.copyOf(beforeLeave);
    }

    /** The normalized absolute path pattern. */
    public String path() {
        return pattern.source();
    }

    public boolean isAlias() {
        return aliasOf != null;
    }

    /** Id of the original record: {@link #aliasOf()} for aliases, {@link #id()} otherwise. */
    public long originId() {
        return aliasOf != null ? aliasOf : id;
    }

    @Override
    public String toString() {
        return "RouteRecord{id=" + id + ", path=" + path() + (name != null ? ", name=" + name : "") + "}";
    }
}
