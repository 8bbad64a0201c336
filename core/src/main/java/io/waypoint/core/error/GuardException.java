package io.waypoint.core.error;

/** A guard failed, or a route's computed redirect threw. */
public final class GuardException extends NavigationException {

    private static final long serialVersionUID = 1L;

    private final String guardPhase;

    public GuardException(
            String message, Throwable cause, long generation, String toPath, String fromPath, String guardPhase) {
        super(message, cause, generation, toPath, fromPath);
        this.guardPhase = guardPhase;
    }

    /** Guard phase that produced the error, e.g. {@code "beforeEach"}, {@code "enter"} or {@code "redirect"}. */
    public String guardPhase() {
        return guardPhase;
    }
}
