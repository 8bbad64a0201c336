package io.waypoint.core.error;

/** The redirect hop bound was exceeded. */
public final class RedirectLoopException extends NavigationException {

    private static final long serialVersionUID = 1L;

    private final int maxRedirects;

    public RedirectLoopException(String message, long generation, String toPath, String fromPath, int maxRedirects) {
        super(message, generation, toPath, fromPath);
        this.maxRedirects = maxRedirects;
    }

    public int maxRedirects() {
        return maxRedirects;
    }
}
