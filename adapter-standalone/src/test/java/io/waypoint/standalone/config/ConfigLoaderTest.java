package io.waypoint.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.waypoint.core.router.RouterOptions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConfigLoader} YAML parsing: key mapping, defaults for missing keys, relative route table
 * paths, and descriptive errors.
 */
@DisplayName("ConfigLoader")
class ConfigLoaderTest {

    private static final Map<String, String> NO_ENV = Map.of();

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource(name).toURI());
    }

    @Nested
    @DisplayName("Minimal config")
    class MinimalConfig {

        @Test
        @DisplayName("Load minimal config → routes resolved against the config directory + all defaults")
        void loadMinimalConfig() throws Exception {
            Path configPath = fixture("config/minimal-config.yaml");

            RouterConfig config = ConfigLoader.load(configPath, NO_ENV::get);

            assertThat(Path.of(config.routesFile()).normalize())
                    .isEqualTo(configPath.getParent().resolve("../routes/app-routes.yaml").normalize());
            assertThat(config.initialLocation()).isEqualTo("/");
            assertThat(config.historyMaxEntries()).isEqualTo(100);
            assertThat(config.maxRedirects()).isEqualTo(10);
            assertThat(config.followRedirects()).isTrue();
            assertThat(config.caseSensitive()).isFalse();
            assertThat(config.cacheEnabled()).isTrue();
            assertThat(config.cacheMinCapacity()).isEqualTo(64);
            assertThat(config.cacheMaxCapacity()).isEqualTo(4096);
            assertThat(config.cacheInitialCapacity()).isEqualTo(512);
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("INFO");
        }
    }

    @Nested
    @DisplayName("Full config")
    class FullConfig {

        @Test
        @DisplayName("Load full config → every key mapped")
        void loadFullConfig() throws Exception {
            RouterConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), NO_ENV::get);

            assertThat(config.routesFile()).isEqualTo(Path.of("/srv/waypoint/routes.yaml").toString());
            assertThat(config.initialLocation()).isEqualTo("/dashboard");
            assertThat(config.historyMaxEntries()).isEqualTo(25);
            assertThat(config.maxRedirects()).isEqualTo(3);
            assertThat(config.followRedirects()).isFalse();
            assertThat(config.caseSensitive()).isTrue();
            assertThat(config.cacheEnabled()).isFalse();
            assertThat(config.cacheMinCapacity()).isEqualTo(8);
            assertThat(config.cacheMaxCapacity()).isEqualTo(128);
            assertThat(config.cacheInitialCapacity()).isEqualTo(32);
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }

        @Test
        @DisplayName("Router options derive from the config")
        void toRouterOptions() throws Exception {
            RouterOptions options =
                    ConfigLoader.load(fixture("config/full-config.yaml"), NO_ENV::get).toRouterOptions();

            assertThat(options.pipeline().maxRedirects()).isEqualTo(3);
            assertThat(options.pipeline().followRedirects()).isFalse();
            assertThat(options.matcher().caseSensitive()).isTrue();
            assertThat(options.matcher().cacheEnabled()).isFalse();
            assertThat(options.matcher().cachePolicy().maxCapacity()).isEqualTo(128);
            assertThat(options.matcher().cachePolicy().initialCapacity()).isEqualTo(32);
        }
    }

    @Nested
    @DisplayName("Error handling")
    class ErrorHandling {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("Missing file → ConfigLoadException naming the path")
        void missingFile() {
            Path missing = tempDir.resolve("nope.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(missing, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Configuration file not found")
                    .hasMessageContaining(missing.toString());
        }

        @Test
        @DisplayName("Invalid YAML → ConfigLoadException with cause")
        void invalidYaml() throws IOException {
            Path bad = tempDir.resolve("bad.yaml");
            Files.writeString(bad, "history: [unclosed");

            assertThatThrownBy(() -> ConfigLoader.load(bad, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Failed to parse YAML configuration")
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("Non-integer value → ConfigLoadException naming the key")
        void nonIntegerValue() throws IOException {
            Path bad = tempDir.resolve("bad-int.yaml");
            Files.writeString(bad, """
                    navigation:
                      max-redirects: lots
                    """);

            assertThatThrownBy(() -> ConfigLoader.load(bad, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("navigation.max-redirects");
        }

        @Test
        @DisplayName("Cache min-capacity above max-capacity → ConfigLoadException with the policy error as cause")
        void inconsistentCacheBounds() throws IOException {
            Path bad = tempDir.resolve("bad-cache.yaml");
            Files.writeString(bad, """
                    matcher:
                      cache:
                        min-capacity: 512
                        max-capacity: 64
                    """);

            assertThatThrownBy(() -> ConfigLoader.load(bad, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Invalid router configuration")
                    .hasMessageContaining("maxCapacity must be >= minCapacity")
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Environment overlay producing inconsistent bounds → ConfigLoadException")
        void inconsistentBoundsFromEnvironment() {
            Map<String, String> env = Map.of("WAYPOINT_CACHE_MIN_CAPACITY", "0");

            assertThatThrownBy(() -> ConfigLoader.defaults(env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("minCapacity must be >= 1");
        }

        @Test
        @DisplayName("history.max-entries below 1 → ConfigLoadException naming the key")
        void historyTooSmall() throws IOException {
            Path bad = tempDir.resolve("bad-history.yaml");
            Files.writeString(bad, """
                    history:
                      max-entries: 0
                    """);

            assertThatThrownBy(() -> ConfigLoader.load(bad, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Configuration key 'history.max-entries' must be >= 1, got: 0");
        }

        @Test
        @DisplayName("Empty file → all defaults")
        void emptyFile() throws IOException {
            Path empty = tempDir.resolve("empty.yaml");
            Files.writeString(empty, "");

            RouterConfig config = ConfigLoader.load(empty, NO_ENV::get);

            assertThat(config).isEqualTo(RouterConfig.builder().build());
        }
    }
}
