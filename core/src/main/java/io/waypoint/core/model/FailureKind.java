package io.waypoint.core.model;

/** Kinds of non-exceptional navigation failures. */
public enum FailureKind {
    /** A guard aborted the navigation. */
    ABORTED,
    /** A newer navigation started before this one could commit. */
    CANCELLED,
    /** The target is the current location. */
    DUPLICATED,
    /** A guard redirected and redirects are not followed. */
    REDIRECTED
}
