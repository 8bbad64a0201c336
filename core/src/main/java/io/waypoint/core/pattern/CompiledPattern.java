package io.waypoint.core.pattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A route pattern compiled into typed segments. Immutable.
 *
 * <p>
 * Captures are exchanged as a list parallel to {@link #paramNames()}: one raw (still percent-encoded) value
 * per capturing segment, {@code null} for an absent optional param.
 */
public final class CompiledPattern {

    private final String source;
    private final List<CompiledSegment> segments;
    private final List<String> paramNames;
    private final int score;

    CompiledPattern(String source, List<CompiledSegment> segments) {
        this.source = source;
        this.segments = List.copyOf(segments);
        List<String> names = new ArrayList<>();
        int total = 0;
        for (CompiledSegment segment : this.segments) {
            if (segment.captures()) {
                names.add(segment.name());
            }
            total += segment.weight();
        }
        this.paramNames = List.copyOf(names);
        this.score = total;
    }

    /** The normalized pattern string, e.g. {@code /user/:id}. */
    public String source() {
        return source;
    }

    public List<CompiledSegment> segments() {
        return segments;
    }

    /** Names of the capturing segments in order. */
    public List<String> paramNames() {
        return paramNames;
    }

    /** Specificity score: higher is more specific. */
    public int score() {
        return score;
    }

    /** Whether the final segment is an optional param. */
    public boolean endsOptional() {
        return !segments.isEmpty() && segments.get(segments.size() - 1).optional();
    }

    /**
     * Binds captures to param names, percent-decoding each value. Absent optional params are omitted.
     *
     * @throws IllegalArgumentException if the capture count does not match
     */
    public Map<String, String> bind(List<String> captures) {
        if (captures.size() != paramNames.size()) {
            throw new IllegalArgumentException(
                    "expected " + paramNames.size() + " captures for '" + source + "', got " + captures.size());
        }
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i < captures.size(); i++) {
            String value = captures.get(i);
            if (value != null) {
                params.put(paramNames.get(i), PathSegments.decode(value));
            }
        }
        return Collections.unmodifiableMap(params);
    }

    /**
     * Builds a concrete path from param values, percent-encoding them.
     *
     * @throws IllegalArgumentException if a required param is missing or blank
     */
    public String buildPath(Map<String, String> params) {
        Objects.requireNonNull(params, "params must not be null");
        StringBuilder sb = new StringBuilder();
        for (CompiledSegment segment : segments) {
            switch (segment.kind()) {
                case STATIC -> sb.append('/').append(segment.text());
                case PARAM -> {
                    String value = params.get(segment.name());
                    if (value == null || value.isEmpty()) {
                        if (!segment.optional()) {
                            throw new IllegalArgumentException(
                                    "Missing required param '" + segment.name() + "' for route '" + source + "'");
                        }
                    } else {
                        sb.append('/').append(PathSegments.encodeSegment(value));
                    }
                }
                case WILDCARD -> {
                    String value = params.get(segment.name());
                    if (value != null && !value.isEmpty()) {
                        sb.append('/').append(PathSegments.encodePath(value));
                    }
                }
            }
        }
        return sb.length() == 0 ? "/" : sb.toString();
    }

    /**
     * Matches path segments against this pattern alone, without any trie. Used to find cache keys a newly
     * added pattern could affect.
     *
     * @return the raw captures, or {@code null} if the path does not match
     */
    public List<String> capture(List<String> pathSegments, boolean caseSensitive) {
        List<String> captures = new ArrayList<>(paramNames.size());
        int n = pathSegments.size();
        for (int i = 0; i < segments.size(); i++) {
            CompiledSegment segment = segments.get(i);
            switch (segment.kind()) {
                case STATIC -> {
                    if (i >= n || !literalEquals(segment.text(), pathSegments.get(i), caseSensitive)) {
                        return null;
                    }
                }
                case PARAM -> {
                    if (i < n) {
                        captures.add(pathSegments.get(i));
                    } else if (segment.optional()) {
                        captures.add(null);
                    } else {
                        return null;
                    }
                }
                case WILDCARD -> {
                    captures.add(i < n ? String.join("/", pathSegments.subList(i, n)) : "");
                    return captures;
                }
            }
        }
        return n <= segments.size() ? captures : null;
    }

    /** Whether a normalized path matches this pattern alone. */
    public boolean matches(String normalizedPath, boolean caseSensitive) {
        return capture(PathSegments.split(normalizedPath), caseSensitive) != null;
    }

    /** Normalizes a literal edge key for the given case sensitivity. */
    public static String literalKey(String text, boolean caseSensitive) {
        return caseSensitive ? text : text.toLowerCase(Locale.ROOT);
    }

    private static boolean literalEquals(String literal, String actual, boolean caseSensitive) {
        return literalKey(literal, caseSensitive).equals(literalKey(actual, caseSensitive));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CompiledPattern other)) {
            return false;
        }
        return source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }

    @Override
    public String toString() {
        return source;
    }
}
