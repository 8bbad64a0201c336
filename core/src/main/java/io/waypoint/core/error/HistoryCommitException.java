package io.waypoint.core.error;

/** The history adapter rejected a push or replace at commit time. */
public final class HistoryCommitException extends NavigationException {

    private static final long serialVersionUID = 1L;

    public HistoryCommitException(String message, Throwable cause, long generation, String toPath, String fromPath) {
        super(message, cause, generation, toPath, fromPath);
    }
}
