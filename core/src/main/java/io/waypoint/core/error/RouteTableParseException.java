package io.waypoint.core.error;

/** A route table file is unreadable, malformed YAML, or violates the route table schema. */
public final class RouteTableParseException extends RouteDefinitionException {

    private static final long serialVersionUID = 1L;

    public RouteTableParseException(String message, String source) {
        super(message, source);
    }

    public RouteTableParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
