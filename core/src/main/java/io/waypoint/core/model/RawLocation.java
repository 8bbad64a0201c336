package io.waypoint.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * An unresolved navigation target: either a path (possibly with query and hash) or a route name with
 * params.
 */
public final class RawLocation {

    private final String path;
    private final String name;
    private final Map<String, String> params;
    private final QueryParams query;
    private final String hash;

    private RawLocation(String path, String name, Map<String, String> params, QueryParams query, String hash) {
        this.path = path;
        this.name = name;
        this.params = params == null ? Map.of() : Map.copyOf(params);
        this.query = query == null ? QueryParams.empty() : query;
        this.hash = hash == null ? "" : hash;
    }

    /**
     * Parses a location string such as {@code /search?q=x#results}. The hash is stored without its
     * {@code #}.
     */
    public static RawLocation parse(String location) {
        Objects.requireNonNull(location, "location must not be null");
        String rest = location;
        String hash = "";
        int hashIdx = rest.indexOf('#');
        if (hashIdx >= 0) {
            hash = rest.substring(hashIdx + 1);
            rest = rest.substring(0, hashIdx);
        }
        QueryParams query = QueryParams.empty();
        int queryIdx = rest.indexOf('?');
        if (queryIdx >= 0) {
            query = QueryParams.parse(rest.substring(queryIdx + 1));
            rest = rest.substring(0, queryIdx);
        }
        return new RawLocation(rest, null, null, query, hash);
    }

    /** A named location. */
    public static RawLocation named(String name, Map<String, String> params) {
        Objects.requireNonNull(name, "name must not be null");
        return new RawLocation(null, name, params, null, null);
    }

    public RawLocation withQuery(QueryParams query) {
        return new RawLocation(path, name, params, query, hash);
    }

    public RawLocation withHash(String hash) {
        return new RawLocation(path, name, params, query, hash);
    }

    public boolean isNamed() {
        return name != null;
    }

    /** Path part, or {@code null} for a named location. */
    public String path() {
        return path;
    }

    /** Route name, or {@code null} for a path location. */
    public String name() {
        return name;
    }

    public Map<String, String> params() {
        return params;
    }

    public QueryParams query() {
        return query;
    }

    /** Hash without {@code #}, empty if none. */
    public String hash() {
        return hash;
    }

    @Override
    public String toString() {
        return isNamed() ? "{name=" + name + ", params=" + params + "}" : path;
    }
}
