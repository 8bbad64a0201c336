package io.waypoint.core.navigation;

/**
 * Navigation pipeline settings.
 *
 * @param maxRedirects    redirect hops allowed per navigation before it fails with a redirect loop
 * @param followRedirects when {@code false}, a redirect ends the navigation with a {@code REDIRECTED} failure
 */
public record PipelineOptions(int maxRedirects, boolean followRedirects) {

    public static final PipelineOptions DEFAULT = new PipelineOptions(10, true);

    public PipelineOptions {
        if (maxRedirects < 0) {
            throw new IllegalArgumentException("maxRedirects must be >= 0, got: " + maxRedirects);
        }
    }
}
