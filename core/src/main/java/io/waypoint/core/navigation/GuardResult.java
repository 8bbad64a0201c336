package io.waypoint.core.navigation;

import io.waypoint.core.model.RawLocation;
import java.util.Objects;

/**
 * Verdict of a navigation guard: continue, abort, redirect to another location, or fail with an error.
 */
public final class GuardResult {

    /** Verdict type. */
    public enum Type {
        CONTINUE,
        ABORT,
        REDIRECT,
        ERROR
    }

    private static final GuardResult PROCEED = new GuardResult(Type.CONTINUE, null, null);
    private static final GuardResult ABORT = new GuardResult(Type.ABORT, null, null);

    private final Type type;
    private final RawLocation redirectTarget;
    private final Throwable error;

    private GuardResult(Type type, RawLocation redirectTarget, Throwable error) {
        this.type = type;
        this.redirectTarget = redirectTarget;
        this.error = error;
    }

    /** Lets the navigation continue to the next guard. */
    public static GuardResult proceed() {
        return PROCEED;
    }

    /** Stops the navigation; the location stays unchanged. */
    public static GuardResult abort() {
        return ABORT;
    }

    /** Restarts the navigation against another target. */
    public static GuardResult redirect(RawLocation target) {
        Objects.requireNonNull(target, "redirect target must not be null");
        return new GuardResult(Type.REDIRECT, target, null);
    }

    /** Restarts the navigation against a location string. */
    public static GuardResult redirect(String location) {
        return redirect(RawLocation.parse(location));
    }

    /** Fails the navigation. */
    public static GuardResult error(Throwable error) {
        Objects.requireNonNull(error, "error must not be null");
        return new GuardResult(Type.ERROR, null, error);
    }

    public Type type() {
        return type;
    }

    public boolean isProceed() {
        return type == Type.CONTINUE;
    }

    /** Redirect target, or {@code null} unless {@link Type#REDIRECT}. */
    public RawLocation redirectTarget() {
        return redirectTarget;
    }

    /** Error, or {@code null} unless {@link Type#ERROR}. */
    public Throwable error() {
        return error;
    }

    @Override
    public String toString() {
        return switch (type) {
            case CONTINUE, ABORT -> "GuardResult{" + type + "}";
            case REDIRECT -> "GuardResult{REDIRECT, to=" + redirectTarget + "}";
            case ERROR -> "GuardResult{ERROR, error=" + error + "}";
        };
    }
}
