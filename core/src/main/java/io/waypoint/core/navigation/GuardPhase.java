package io.waypoint.core.navigation;

/** Guard phases, in execution order. */
public enum GuardPhase {
    BEFORE_EACH("beforeEach"),
    LEAVE("leave"),
    ENTER("enter"),
    BEFORE_RESOLVE("beforeResolve");

    private final String label;

    GuardPhase(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
