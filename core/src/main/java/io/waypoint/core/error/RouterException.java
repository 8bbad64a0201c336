package io.waypoint.core.error;

/**
 * Abstract base for all waypoint exceptions. Never thrown directly; use the concrete subclasses under
 * {@link RouteDefinitionException} or {@link NavigationException}.
 */
public abstract class RouterException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        REGISTRATION,
        NAVIGATION
    }

    private final Phase phase;

    protected RouterException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected RouterException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
