package io.waypoint.core.model;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable multi-valued query parameters, in insertion order. Repeated keys keep all their values.
 */
public final class QueryParams {

    private static final QueryParams EMPTY = new QueryParams(Map.of());

    private final Map<String, List<String>> values;

    private QueryParams(Map<String, List<String>> values) {
        this.values = values;
    }

    public static QueryParams empty() {
        return EMPTY;
    }

    /** Single-valued parameters from a map. */
    public static QueryParams of(Map<String, String> single) {
        Objects.requireNonNull(single, "single must not be null");
        Map<String, List<String>> copy = new LinkedHashMap<>();
        single.forEach((k, v) -> copy.put(k, List.of(v)));
        return wrap(copy);
    }

    /** Multi-valued parameters from a map. */
    public static QueryParams ofMulti(Map<String, List<String>> multi) {
        Objects.requireNonNull(multi, "multi must not be null");
        Map<String, List<String>> copy = new LinkedHashMap<>();
        multi.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return wrap(copy);
    }

    /**
     * Parses a query string, with or without a leading {@code ?}. A key without {@code =} gets an empty
     * value; {@code +} decodes to a space.
     */
    public static QueryParams parse(String query) {
        if (query == null) {
            return EMPTY;
        }
        String q = query.startsWith("?") ? query.substring(1) : query;
        if (q.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<String>> parsed = new LinkedHashMap<>();
        for (String pair : q.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = decode(eq < 0 ? pair : pair.substring(0, eq));
            String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
            parsed.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        }
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        parsed.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return wrap(frozen);
    }

    /** First value for a key, or {@code null}. */
    public String first(String key) {
        List<String> list = values.get(key);
        return list == null || list.isEmpty() ? null : list.get(0);
    }

    /** All values for a key; empty if absent. */
    public List<String> all(String key) {
        return values.getOrDefault(key, List.of());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, List<String>> asMap() {
        return values;
    }

    /** Copy with {@code key} set to a single value, replacing earlier values. */
    public QueryParams with(String key, String value) {
        Map<String, List<String>> copy = new LinkedHashMap<>(values);
        copy.put(key, List.of(value));
        return wrap(copy);
    }

    /** Serializes without a leading {@code ?}; empty values render as a bare key. */
    public String toQueryString() {
        StringBuilder sb = new StringBuilder();
        values.forEach((key, list) -> {
            for (String value : list) {
                if (sb.length() > 0) {
                    sb.append('&');
                }
                sb.append(encode(key));
                if (!value.isEmpty()) {
                    sb.append('=').append(encode(value));
                }
            }
        });
        return sb.toString();
    }

    private static QueryParams wrap(Map<String, List<String>> map) {
        return map.isEmpty() ? EMPTY : new QueryParams(Collections.unmodifiableMap(map));
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return s;
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QueryParams other)) {
            return false;
        }
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "QueryParams" + values;
    }
}
