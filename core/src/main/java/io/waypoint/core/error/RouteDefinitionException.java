package io.waypoint.core.error;

/**
 * Base for errors raised while registering routes: malformed patterns, conflicting registrations and
 * unreadable route tables. Fatal to the registration call only; previously registered routes are untouched.
 */
public abstract class RouteDefinitionException extends RouterException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected RouteDefinitionException(String message, String source) {
        super(message, Phase.REGISTRATION);
        this.source = source;
    }

    protected RouteDefinitionException(String message, Throwable cause, String source) {
        super(message, cause, Phase.REGISTRATION);
        this.source = source;
    }

    /** The offending pattern, route name or file path, or {@code null} if unknown. */
    public String source() {
        return source;
    }
}
