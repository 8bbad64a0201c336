package io.waypoint.standalone.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line.
 *
 * <pre>
 * waypoint [--config waypoint.yaml] [--routes routes.yaml] [--stats] STEP...
 *
 * STEP is one of
 *   /path?query#hash    push
 *   replace:/path       replace
 *   back | forward      history move
 * </pre>
 *
 * @param configPath explicit {@code --config} file, or {@code null}
 * @param routesFile {@code --routes} file overriding the configured one, or {@code null}
 * @param stats      print cache statistics and hotspots after the steps
 * @param steps      navigation steps in order
 */
public record CliArguments(Path configPath, String routesFile, boolean stats, List<Step> steps) {

    private static final String REPLACE_PREFIX = "replace:";

    public CliArguments {
        steps = List.copyOf(steps);
    }

    /** One navigation requested on the command line. */
    public record Step(Kind kind, String location) {

        /** Step type. */
        public enum Kind {
            PUSH,
            REPLACE,
            BACK,
            FORWARD
        }

        /** The step as typed, used to label its output line. */
        public String label() {
            return switch (kind) {
                case PUSH -> location;
                case REPLACE -> REPLACE_PREFIX + location;
                case BACK -> "back";
                case FORWARD -> "forward";
            };
        }
    }

    /**
     * @throws IllegalArgumentException on an unknown flag, a flag without its value, or an unrecognized step
     */
    public static CliArguments parse(String[] args) {
        Path configPath = null;
        String routesFile = null;
        boolean stats = false;
        List<Step> steps = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config" -> configPath = Path.of(value(args, ++i, arg));
                case "--routes" -> routesFile = value(args, ++i, arg);
                case "--stats" -> stats = true;
                case "back" -> steps.add(new Step(Step.Kind.BACK, null));
                case "forward" -> steps.add(new Step(Step.Kind.FORWARD, null));
                default -> steps.add(step(arg));
            }
        }
        return new CliArguments(configPath, routesFile, stats, steps);
    }

    private static String value(String[] args, int index, String flag) {
        if (index >= args.length) {
            throw new IllegalArgumentException(flag + " requires a file path argument");
        }
        return args[index];
    }

    private static Step step(String arg) {
        if (arg.startsWith("--")) {
            throw new IllegalArgumentException("Unknown option: " + arg);
        }
        if (arg.startsWith(REPLACE_PREFIX)) {
            return new Step(Step.Kind.REPLACE, arg.substring(REPLACE_PREFIX.length()));
        }
        if (arg.startsWith("/")) {
            return new Step(Step.Kind.PUSH, arg);
        }
        throw new IllegalArgumentException(
                "Unrecognized step '" + arg + "': expected a path starting with '/', replace:<path>, back or forward");
    }
}
