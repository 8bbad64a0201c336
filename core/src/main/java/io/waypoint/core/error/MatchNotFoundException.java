package io.waypoint.core.error;

/**
 * Raised only by navigation: a target with no matching record cannot be committed. {@code resolve()} reports
 * the same condition as a normal unmatched location instead.
 */
public final class MatchNotFoundException extends NavigationException {

    private static final long serialVersionUID = 1L;

    public MatchNotFoundException(String message, long generation, String toPath, String fromPath) {
        super(message, generation, toPath, fromPath);
    }

    public MatchNotFoundException(String message, Throwable cause, long generation, String toPath, String fromPath) {
        super(message, cause, generation, toPath, fromPath);
    }
}
