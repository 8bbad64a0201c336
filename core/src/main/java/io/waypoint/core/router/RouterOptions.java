package io.waypoint.core.router;

import io.waypoint.core.matcher.MatcherOptions;
import io.waypoint.core.navigation.PipelineOptions;
import io.waypoint.core.spi.NavigationListener;
import java.util.Objects;

/**
 * Router settings.
 *
 * @param matcher  matcher and cache settings
 * @param pipeline navigation pipeline settings
 * @param listener telemetry listener, or {@code null}
 */
public record RouterOptions(MatcherOptions matcher, PipelineOptions pipeline, NavigationListener listener) {

    public static final RouterOptions DEFAULT = new RouterOptions(MatcherOptions.DEFAULT, PipelineOptions.DEFAULT, null);

    public RouterOptions {
        Objects.requireNonNull(matcher, "matcher must not be null");
        Objects.requireNonNull(pipeline, "pipeline must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link RouterOptions}. */
    public static final class Builder {
        private MatcherOptions matcher = MatcherOptions.DEFAULT;
        private PipelineOptions pipeline = PipelineOptions.DEFAULT;
        private NavigationListener listener;

        private Builder() {}

        public Builder matcher(MatcherOptions matcher) {
            this.matcher = matcher;
            return this;
        }

        public Builder pipeline(PipelineOptions pipeline) {
            this.pipeline = pipeline;
            return this;
        }

        public Builder maxRedirects(int maxRedirects) {
            this.pipeline = new PipelineOptions(maxRedirects, pipeline.followRedirects());
            return this;
        }

        public Builder followRedirects(boolean follow) {
            this.pipeline = new PipelineOptions(pipeline.maxRedirects(), follow);
            return this;
        }

        public Builder cacheEnabled(boolean enabled) {
            this.matcher = matcher.withCacheEnabled(enabled);
            return this;
        }

        public Builder caseSensitive(boolean sensitive) {
            this.matcher = matcher.withCaseSensitive(sensitive);
            return this;
        }

        public Builder listener(NavigationListener listener) {
            this.listener = listener;
            return this;
        }

        public RouterOptions build() {
            return new RouterOptions(matcher, pipeline, listener);
        }
    }
}
