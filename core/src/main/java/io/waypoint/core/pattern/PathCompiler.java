package io.waypoint.core.pattern;

import io.waypoint.core.error.PatternCompileException;
import io.waypoint.core.error.PatternCompileException.Reason;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Compiles route pattern strings into {@link CompiledPattern}s.
 *
 * <p>
 * Supported segment syntax:
 * <ul>
 * <li>{@code users} static text</li>
 * <li>{@code :id} or {@code {id}} required param</li>
 * <li>{@code :id?} or {@code {id?}} optional param (final segment only)</li>
 * <li>{@code *} or {@code *name} wildcard capturing the remaining path (final segment only, at most one)</li>
 * </ul>
 *
 * <p>
 * Pure and stateless; safe to share.
 */
public final class PathCompiler {

    /** Capture name of an anonymous {@code *} wildcard. */
    public static final String DEFAULT_WILDCARD_NAME = "pathMatch";

    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private PathCompiler() {}

    /**
     * Compiles a pattern.
     *
     * @param pattern raw pattern, e.g. {@code /user/:id/files/*}
     * @return the compiled pattern
     * @throws PatternCompileException if the pattern is malformed
     */
    public static CompiledPattern compile(String pattern) {
        if (pattern == null) {
            throw new IllegalArgumentException("pattern must not be null");
        }
        String normalized = PathSegments.normalize(pattern);
        List<String> raw = PathSegments.split(normalized);
        List<CompiledSegment> segments = new ArrayList<>(raw.size());
        Set<String> names = new HashSet<>();
        int wildcards = 0;
        for (int i = 0; i < raw.size(); i++) {
            CompiledSegment segment = parseSegment(pattern, raw.get(i), i);
            if (segment.kind() == SegmentKind.WILDCARD) {
                wildcards++;
                if (wildcards > 1) {
                    throw fail(pattern, Reason.MULTIPLE_WILDCARDS, i, "more than one wildcard");
                }
            }
            if (segment.captures() && !names.add(segment.name())) {
                throw fail(pattern, Reason.DUPLICATE_PARAMETER_NAME, i, "duplicate parameter '" + segment.name() + "'");
            }
            segments.add(segment);
        }
        int last = segments.size() - 1;
        for (int i = 0; i < last; i++) {
            CompiledSegment segment = segments.get(i);
            if (segment.kind() == SegmentKind.WILDCARD) {
                throw fail(pattern, Reason.WILDCARD_NOT_FINAL, i, "wildcard must be the final segment");
            }
            if (segment.optional()) {
                throw fail(pattern, Reason.OPTIONAL_NOT_FINAL, i, "optional parameter must be the final segment");
            }
        }
        return new CompiledPattern(normalized, segments);
    }

    /**
     * Joins a nested route's path onto its parent's. Absolute child paths (leading {@code /}) are used as-is;
     * relative ones are appended to the parent path.
     */
    public static String joinChild(String parentPath, String childPath) {
        if (childPath == null || childPath.isEmpty()) {
            return PathSegments.normalize(parentPath);
        }
        if (childPath.startsWith("/")) {
            return PathSegments.normalize(childPath);
        }
        return PathSegments.normalize(parentPath + "/" + childPath);
    }

    private static CompiledSegment parseSegment(String pattern, String text, int index) {
        char first = text.charAt(0);
        if (first == ':') {
            return parseParam(pattern, text.substring(1), index);
        }
        if (first == '{') {
            if (!text.endsWith("}")) {
                throw fail(pattern, Reason.UNTERMINATED_PARAMETER, index, "missing '}' in '" + text + "'");
            }
            return parseParam(pattern, text.substring(1, text.length() - 1), index);
        }
        if (first == '*') {
            String name = text.length() == 1 ? DEFAULT_WILDCARD_NAME : text.substring(1);
            requireName(pattern, name, index);
            return CompiledSegment.wildcard(name);
        }
        return CompiledSegment.literal(text);
    }

    private static CompiledSegment parseParam(String pattern, String body, int index) {
        boolean optional = body.endsWith("?");
        String name = optional ? body.substring(0, body.length() - 1) : body;
        if (name.isEmpty()) {
            throw fail(pattern, Reason.UNTERMINATED_PARAMETER, index, "parameter has no name");
        }
        requireName(pattern, name, index);
        return CompiledSegment.param(name, optional);
    }

    private static void requireName(String pattern, String name, int index) {
        if (!NAME.matcher(name).matches()) {
            throw fail(pattern, Reason.INVALID_PARAMETER_NAME, index, "invalid parameter name '" + name + "'");
        }
    }

    private static PatternCompileException fail(String pattern, Reason reason, int index, String detail) {
        return new PatternCompileException(
                String.format("Invalid route pattern '%s' at segment %d: %s", pattern, index, detail),
                pattern,
                reason,
                index);
    }
}
