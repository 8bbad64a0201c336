package io.waypoint.core.error;

/** A route pattern could not be compiled into segments. */
public final class PatternCompileException extends RouteDefinitionException {

    private static final long serialVersionUID = 1L;

    /** What was wrong with the pattern. */
    public enum Reason {
        UNTERMINATED_PARAMETER,
        INVALID_PARAMETER_NAME,
        DUPLICATE_PARAMETER_NAME,
        WILDCARD_NOT_FINAL,
        MULTIPLE_WILDCARDS,
        OPTIONAL_NOT_FINAL
    }

    private final Reason reason;
    private final int segmentIndex;

    public PatternCompileException(String message, String pattern, Reason reason, int segmentIndex) {
        super(message, pattern);
        this.reason = reason;
        this.segmentIndex = segmentIndex;
    }

    public Reason reason() {
        return reason;
    }

    /** Zero-based index of the offending segment. */
    public int segmentIndex() {
        return segmentIndex;
    }
}
