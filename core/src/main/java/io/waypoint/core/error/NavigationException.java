package io.waypoint.core.error;

/**
 * Base for errors that fail an in-flight navigation. These are delivered to the registered error handlers
 * and complete the caller's future exceptionally; the current location is left unchanged.
 */
public abstract class NavigationException extends RouterException {

    private static final long serialVersionUID = 1L;

    private final long generation;
    private final String toPath;
    private final String fromPath;

    protected NavigationException(String message, long generation, String toPath, String fromPath) {
        super(message, Phase.NAVIGATION);
        this.generation = generation;
        this.toPath = toPath;
        this.fromPath = fromPath;
    }

    protected NavigationException(String message, Throwable cause, long generation, String toPath, String fromPath) {
        super(message, cause, Phase.NAVIGATION);
        this.generation = generation;
        this.toPath = toPath;
        this.fromPath = fromPath;
    }

    /** Generation of the navigation that failed. */
    public long generation() {
        return generation;
    }

    /** Requested target, as a full path. */
    public String toPath() {
        return toPath;
    }

    /** Location the navigation started from, as a full path. */
    public String fromPath() {
        return fromPath;
    }
}
