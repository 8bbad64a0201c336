package io.waypoint.core.pattern;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Path normalization and percent-coding helpers shared by the compiler, the matcher and location
 * resolution.
 */
public final class PathSegments {

    private PathSegments() {}

    /**
     * Normalizes a path: ensures a leading {@code /}, collapses repeated slashes and drops a trailing slash.
     * The root path stays {@code /}. A {@code null} or blank input normalizes to {@code /}.
     */
    public static String normalize(String path) {
        if (path == null || path.isBlank()) {
            return "/";
        }
        StringBuilder sb = new StringBuilder(path.length() + 1);
        sb.append('/');
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '/' && sb.charAt(sb.length() - 1) == '/') {
                continue;
            }
            sb.append(c);
        }
        if (sb.length() > 1 && sb.charAt(sb.length() - 1) == '/') {
            sb.setLength(sb.length() - 1);
        }
        return sb.toString();
    }

    /** Splits a normalized path into segments. The root path has no segments. */
    public static List<String> split(String normalizedPath) {
        List<String> segments = new ArrayList<>();
        int start = 1;
        int len = normalizedPath.length();
        while (start < len) {
            int slash = normalizedPath.indexOf('/', start);
            int end = slash < 0 ? len : slash;
            segments.add(normalizedPath.substring(start, end));
            start = end + 1;
        }
        return segments;
    }

    /** Joins segments back into a path with a leading slash. */
    public static String join(List<String> segments) {
        return segments.isEmpty() ? "/" : "/" + String.join("/", segments);
    }

    /**
     * Percent-decodes a path value. A literal {@code +} stays a plus sign; malformed escapes are returned
     * unchanged.
     */
    public static String decode(String raw) {
        if (raw.indexOf('%') < 0) {
            return raw;
        }
        try {
            return URLDecoder.decode(raw.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return raw;
        }
    }

    /** Percent-encodes a single path segment value. */
    public static String encodeSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /** Percent-encodes a multi-segment value, keeping {@code /} separators. */
    public static String encodePath(String value) {
        String[] parts = value.split("/", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append('/');
            }
            sb.append(encodeSegment(parts[i]));
        }
        return sb.toString();
    }
}
