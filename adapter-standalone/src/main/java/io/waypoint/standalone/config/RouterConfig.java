package io.waypoint.standalone.config;

import io.waypoint.core.cache.CachePolicy;
import io.waypoint.core.matcher.MatcherOptions;
import io.waypoint.core.navigation.PipelineOptions;
import io.waypoint.core.router.RouterOptions;
import io.waypoint.standalone.history.MemoryHistory;

/**
 * Root configuration for the standalone router host.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances.
 *
 * @param routesFile           route table YAML file, or {@code null} to start with no routes
 * @param initialLocation      location of the first history entry
 * @param historyMaxEntries    bound on the in-memory history stack
 * @param maxRedirects         redirect hops allowed per navigation
 * @param followRedirects      follow guard and record redirects; when {@code false} they end as REDIRECTED
 * @param caseSensitive        match static segments case-sensitively
 * @param cacheEnabled         enable the match cache
 * @param cacheMinCapacity     lower bound for the adaptive cache capacity
 * @param cacheMaxCapacity     upper bound for the adaptive cache capacity
 * @param cacheInitialCapacity starting cache capacity
 * @param loggingFormat        json or text
 * @param loggingLevel         root log level
 */
public record RouterConfig(
        String routesFile,
        String initialLocation,
        int historyMaxEntries,
        int maxRedirects,
        boolean followRedirects,
        boolean caseSensitive,
        boolean cacheEnabled,
        int cacheMinCapacity,
        int cacheMaxCapacity,
        int cacheInitialCapacity,
        String loggingFormat,
        String loggingLevel) {

    public static Builder builder() {
        return new Builder();
    }

    /** Core router options derived from this configuration. */
    public RouterOptions toRouterOptions() {
        CachePolicy defaults = CachePolicy.DEFAULT;
        CachePolicy policy = new CachePolicy(
                cacheMinCapacity,
                cacheMaxCapacity,
                cacheInitialCapacity,
                defaults.checkInterval(),
                defaults.lowHitRate(),
                defaults.highHitRate(),
                defaults.growthFactor(),
                defaults.shrinkFactor());
        MatcherOptions matcher = new MatcherOptions(
                caseSensitive, cacheEnabled, policy, MatcherOptions.DEFAULT.maxTrackedPaths());
        return RouterOptions.builder()
                .matcher(matcher)
                .pipeline(new PipelineOptions(maxRedirects, followRedirects))
                .build();
    }

    /** Builder for {@link RouterConfig}. */
    public static final class Builder {
        private String routesFile;
        private String initialLocation = "/";
        private int historyMaxEntries = MemoryHistory.DEFAULT_MAX_ENTRIES;
        private int maxRedirects = PipelineOptions.DEFAULT.maxRedirects();
        private boolean followRedirects = true;
        private boolean caseSensitive = false;
        private boolean cacheEnabled = true;
        private int cacheMinCapacity = CachePolicy.DEFAULT.minCapacity();
        private int cacheMaxCapacity = CachePolicy.DEFAULT.maxCapacity();
        private int cacheInitialCapacity = CachePolicy.DEFAULT.initialCapacity();
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        private Builder() {}

        public Builder routesFile(String routesFile) {
            this.routesFile = routesFile;
            return this;
        }

        public Builder initialLocation(String initialLocation) {
            this.initialLocation = initialLocation;
            return this;
        }

        public Builder historyMaxEntries(int historyMaxEntries) {
            this.historyMaxEntries = historyMaxEntries;
            return this;
        }

        public Builder maxRedirects(int maxRedirects) {
            this.maxRedirects = maxRedirects;
            return this;
        }

        public Builder followRedirects(boolean followRedirects) {
            this.followRedirects = followRedirects;
            return this;
        }

        public Builder caseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder cacheMinCapacity(int cacheMinCapacity) {
            this.cacheMinCapacity = cacheMinCapacity;
            return this;
        }

        public Builder cacheMaxCapacity(int cacheMaxCapacity) {
            this.cacheMaxCapacity = cacheMaxCapacity;
            return this;
        }

        public Builder cacheInitialCapacity(int cacheInitialCapacity) {
            this.cacheInitialCapacity = cacheInitialCapacity;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public RouterConfig build() {
            return new RouterConfig(
                    routesFile,
                    initialLocation,
                    historyMaxEntries,
                    maxRedirects,
                    followRedirects,
                    caseSensitive,
                    cacheEnabled,
                    cacheMinCapacity,
                    cacheMaxCapacity,
                    cacheInitialCapacity,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
