package io.waypoint.standalone;

import io.waypoint.standalone.cli.CliArguments;
import io.waypoint.standalone.cli.LogbackConfigurator;
import io.waypoint.standalone.cli.StandaloneApp;
import io.waypoint.standalone.config.RouterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the headless router.
 *
 * <p>
 * Delegates to {@link StandaloneApp}. On a startup failure, logs the error and exits with status 1; a
 * navigation that fails with an error also yields status 1 after all steps ran.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --routes routes.yaml /user/42 back})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            CliArguments cli = CliArguments.parse(args);
            RouterConfig config = StandaloneApp.loadConfig(cli, System::getenv);
            LogbackConfigurator.configure(config.loggingFormat(), config.loggingLevel());
            status = StandaloneApp.execute(config, cli, System.out);
        } catch (Exception e) {
            LOG.error("Startup failed: {}", e.getMessage(), e);
            status = 1;
        }
        if (status != 0) {
            System.exit(status);
        }
    }
}
