package io.waypoint.core.pattern;

import java.util.Objects;

/**
 * One {@code /}-delimited unit of a compiled pattern: {@code Static(text)}, {@code Param(name, optional)} or
 * {@code Wildcard(name)}.
 *
 * @param kind     segment kind
 * @param text     literal text for {@link SegmentKind#STATIC}, {@code null} otherwise
 * @param name     capture name for params and wildcards, {@code null} for static segments
 * @param optional whether a param may be absent; always {@code false} for other kinds
 */
public record CompiledSegment(SegmentKind kind, String text, String name, boolean optional) {

    /** Score contribution of a static segment. */
    public static final int STATIC_WEIGHT = 1000;

    /** Score contribution of a required param. */
    public static final int PARAM_WEIGHT = 0;

    /** Score contribution of an optional param or a wildcard. */
    public static final int LOOSE_WEIGHT = -10;

    public CompiledSegment {
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind == SegmentKind.STATIC) {
            Objects.requireNonNull(text, "static segment text must not be null");
        } else {
            Objects.requireNonNull(name, "capture name must not be null");
        }
        if (optional && kind != SegmentKind.PARAM) {
            throw new IllegalArgumentException("only params can be optional");
        }
    }

    public static CompiledSegment literal(String text) {
        return new CompiledSegment(SegmentKind.STATIC, text, null, false);
    }

    public static CompiledSegment param(String name, boolean optional) {
        return new CompiledSegment(SegmentKind.PARAM, null, name, optional);
    }

    public static CompiledSegment wildcard(String name) {
        return new CompiledSegment(SegmentKind.WILDCARD, null, name, false);
    }

    /** Whether this segment captures a value (param or wildcard). */
    public boolean captures() {
        return kind != SegmentKind.STATIC;
    }

    /** Specificity contribution of this segment. */
    public int weight() {
        return switch (kind) {
            case STATIC -> STATIC_WEIGHT;
            case PARAM -> optional ? LOOSE_WEIGHT : PARAM_WEIGHT;
            case WILDCARD -> LOOSE_WEIGHT;
        };
    }

    /** Pattern-syntax rendering, e.g. {@code users}, {@code :id?} or {@code *rest}. */
    @Override
    public String toString() {
        return switch (kind) {
            case STATIC -> text;
            case PARAM -> ":" + name + (optional ? "?" : "");
            case WILDCARD -> PathCompiler.DEFAULT_WILDCARD_NAME.equals(name) ? "*" : "*" + name;
        };
    }
}
