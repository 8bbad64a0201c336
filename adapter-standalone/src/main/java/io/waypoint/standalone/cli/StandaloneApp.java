package io.waypoint.standalone.cli;

import io.waypoint.core.model.NavigationResult;
import io.waypoint.core.router.Router;
import io.waypoint.core.spec.RouteTable;
import io.waypoint.core.spec.RouteTableParser;
import io.waypoint.standalone.config.ConfigLoader;
import io.waypoint.standalone.config.RouterConfig;
import io.waypoint.standalone.history.MemoryHistory;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Headless router host: loads the configuration and route table, starts a {@link Router} on a
 * {@link MemoryHistory}, runs the requested steps in order and prints one JSON line per outcome.
 *
 * <p>
 * Startup sequence:
 * <ol>
 * <li>Load {@code --config}, else {@code waypoint.yaml} if present, else defaults; overlay the environment</li>
 * <li>Apply {@code --routes} over the configured route table</li>
 * <li>Parse the route table, declare its groups and register its routes</li>
 * <li>Run the initial navigation to the configured initial location</li>
 * </ol>
 */
public final class StandaloneApp {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneApp.class);

    private StandaloneApp() {
        // utility class
    }

    /**
     * Resolves the effective configuration for a command line.
     *
     * @throws io.waypoint.standalone.config.ConfigLoadException if an explicit config file is missing or invalid
     */
    public static RouterConfig loadConfig(CliArguments cli, Function<String, String> envLookup) {
        RouterConfig config;
        if (cli.configPath() != null) {
            config = ConfigLoader.load(cli.configPath(), envLookup);
        } else if (Files.exists(Path.of(ConfigLoader.DEFAULT_CONFIG_FILE))) {
            config = ConfigLoader.load(Path.of(ConfigLoader.DEFAULT_CONFIG_FILE), envLookup);
        } else {
            config = ConfigLoader.defaults(envLookup);
        }
        if (cli.routesFile() != null) {
            config = new RouterConfig(
                    cli.routesFile(),
                    config.initialLocation(),
                    config.historyMaxEntries(),
                    config.maxRedirects(),
                    config.followRedirects(),
                    config.caseSensitive(),
                    config.cacheEnabled(),
                    config.cacheMinCapacity(),
                    config.cacheMaxCapacity(),
                    config.cacheInitialCapacity(),
                    config.loggingFormat(),
                    config.loggingLevel());
        }
        return config;
    }

    /**
     * Runs the start navigation and every step, printing results to {@code out}.
     *
     * @return {@code 0} if no navigation failed with an error, else {@code 1}
     * @throws io.waypoint.core.error.RouteDefinitionException if the route table is invalid
     */
    public static int execute(RouterConfig config, CliArguments cli, PrintStream out) {
        MemoryHistory history = new MemoryHistory(config.initialLocation(), config.historyMaxEntries());
        ResultWriter writer = new ResultWriter(out);
        boolean errors = false;
        try (Router router = new Router(config.toRouterOptions(), history)) {
            if (config.routesFile() != null) {
                register(router, new RouteTableParser().parse(Path.of(config.routesFile())));
            }
            errors |= !report(writer, "start", router.start());
            for (CliArguments.Step step : cli.steps()) {
                errors |= !report(writer, step.label(), run(router, step));
            }
            if (cli.stats()) {
                writer.stats(router.cacheStats(), router.hotspots(10));
            }
        }
        return errors ? 1 : 0;
    }

    private static void register(Router router, RouteTable table) {
        table.groups().forEach(router::createGroup);
        for (RouteTable.Entry entry : table.entries()) {
            router.addRoute(entry.group(), entry.definition());
        }
        LOG.info("Loaded {} routes from {}", router.getRoutes().size(), table.source());
    }

    private static CompletableFuture<NavigationResult> run(Router router, CliArguments.Step step) {
        return switch (step.kind()) {
            case PUSH -> router.push(step.location());
            case REPLACE -> router.replace(step.location());
            case BACK -> router.back();
            case FORWARD -> router.forward();
        };
    }

    /** Waits for the outcome and writes it; returns {@code false} if it completed with an error. */
    private static boolean report(ResultWriter writer, String step, CompletableFuture<NavigationResult> outcome) {
        try {
            writer.result(step, outcome.join());
            return true;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            writer.error(step, cause);
            return false;
        }
    }
}
