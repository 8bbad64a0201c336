package io.waypoint.core.pattern;

/** Kind of a compiled pattern segment. */
public enum SegmentKind {
    STATIC,
    PARAM,
    WILDCARD
}
