package io.waypoint.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link RouterConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * routes: routes.yaml
 * history:
 *   initial-location: /
 *   max-entries: 100
 * navigation:
 *   max-redirects: 10
 *   follow-redirects: true
 * matcher:
 *   case-sensitive: false
 *   cache:
 *     enabled: true
 *     min-capacity: 64
 *     max-capacity: 4096
 *     initial-capacity: 512
 * logging:
 *   format: text
 *   level: INFO
 * </pre>
 *
 * <p>
 * Missing keys keep the defaults of {@link RouterConfig.Builder}. A relative {@code routes} path is resolved
 * against the directory of the configuration file.
 *
 * <p>
 * Every key can be overridden by a {@code WAYPOINT_*} environment variable, which takes precedence over the
 * YAML value. A variable counts as set only if it is defined and non-blank after trimming.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    /** Configuration file looked up in the working directory when no {@code --config} is given. */
    public static final String DEFAULT_CONFIG_FILE = "waypoint.yaml";

    private ConfigLoader() {
        // utility class
    }

    /** Loads the given file, overlaying {@link System#getenv}. */
    public static RouterConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads the given file, overlaying variables from {@code envLookup} ({@code null} means undefined).
     *
     * @throws ConfigLoadException if the file is missing or not valid YAML, or holds a malformed or
     *     inconsistent value
     */
    public static RouterConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        RouterConfig.Builder builder = RouterConfig.builder();
        if (root != null && !root.isMissingNode() && !root.isNull()) {
            mapYaml(root, configPath, builder);
        }
        return overlay(builder, envLookup);
    }

    /** Defaults plus the environment overlay, for running without a configuration file. */
    public static RouterConfig defaults(Function<String, String> envLookup) {
        return overlay(RouterConfig.builder(), envLookup);
    }

    private static void mapYaml(JsonNode root, Path configPath, RouterConfig.Builder builder) {
        if (root.has("routes")) {
            Path routes = Path.of(root.get("routes").asText());
            Path base = configPath.toAbsolutePath().getParent();
            builder.routesFile((routes.isAbsolute() || base == null ? routes : base.resolve(routes)).toString());
        }

        JsonNode history = root.path("history");
        if (history.has("initial-location"))
            builder.initialLocation(history.get("initial-location").asText());
        if (history.has("max-entries")) builder.historyMaxEntries(intValue(history, "history.max-entries"));

        JsonNode navigation = root.path("navigation");
        if (navigation.has("max-redirects"))
            builder.maxRedirects(intValue(navigation, "navigation.max-redirects"));
        if (navigation.has("follow-redirects"))
            builder.followRedirects(navigation.get("follow-redirects").asBoolean());

        JsonNode matcher = root.path("matcher");
        if (matcher.has("case-sensitive"))
            builder.caseSensitive(matcher.get("case-sensitive").asBoolean());
        JsonNode cache = matcher.path("cache");
        if (cache.has("enabled")) builder.cacheEnabled(cache.get("enabled").asBoolean());
        if (cache.has("min-capacity")) builder.cacheMinCapacity(intValue(cache, "matcher.cache.min-capacity"));
        if (cache.has("max-capacity")) builder.cacheMaxCapacity(intValue(cache, "matcher.cache.max-capacity"));
        if (cache.has("initial-capacity"))
            builder.cacheInitialCapacity(intValue(cache, "matcher.cache.initial-capacity"));

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
    }

    private static int intValue(JsonNode section, String key) {
        JsonNode value = section.get(key.substring(key.lastIndexOf('.') + 1));
        if (!value.isNumber() || !value.canConvertToInt()) {
            throw new ConfigLoadException("Configuration key '" + key + "' must be an integer, got: " + value);
        }
        return value.asInt();
    }

    private static RouterConfig overlay(RouterConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "WAYPOINT_ROUTES", builder::routesFile);
        envString(envLookup, "WAYPOINT_INITIAL_LOCATION", builder::initialLocation);
        envString(envLookup, "WAYPOINT_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "WAYPOINT_LOG_LEVEL", builder::loggingLevel);

        envInt(envLookup, "WAYPOINT_HISTORY_MAX_ENTRIES", builder::historyMaxEntries);
        envInt(envLookup, "WAYPOINT_MAX_REDIRECTS", builder::maxRedirects);
        envInt(envLookup, "WAYPOINT_CACHE_MIN_CAPACITY", builder::cacheMinCapacity);
        envInt(envLookup, "WAYPOINT_CACHE_MAX_CAPACITY", builder::cacheMaxCapacity);
        envInt(envLookup, "WAYPOINT_CACHE_INITIAL_CAPACITY", builder::cacheInitialCapacity);

        envBool(envLookup, "WAYPOINT_FOLLOW_REDIRECTS", builder::followRedirects);
        envBool(envLookup, "WAYPOINT_CASE_SENSITIVE", builder::caseSensitive);
        envBool(envLookup, "WAYPOINT_CACHE_ENABLED", builder::cacheEnabled);
        return validate(builder.build());
    }

    /** Rejects values that would only fail later, when the router is built. */
    private static RouterConfig validate(RouterConfig config) {
        if (config.historyMaxEntries() < 1) {
            throw new ConfigLoadException(
                    "Configuration key 'history.max-entries' must be >= 1, got: " + config.historyMaxEntries());
        }
        try {
            config.toRouterOptions();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid router configuration: " + e.getMessage(), e);
        }
        return config;
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String raw = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(raw));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException("Environment variable " + envVar + " must be an integer, got: " + raw, e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
