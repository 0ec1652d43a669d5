package org.carball.bowling.config;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_OUTPUT_FORMAT = "BOWLING_OUTPUT_FORMAT";
    static final String ENV_VERBOSE = "BOWLING_VERBOSE";

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public BowlingCliConfig loadConfiguration(String[] args) {
        return loadConfiguration(args, System.getenv());
    }

    public BowlingCliConfig loadConfiguration(String[] args, Map<String, String> env) {
        log.debug("Loading configuration");

        // Start with defaults
        BowlingCliConfig config = new BowlingCliConfig();

        // 1. Apply environment variables
        applyEnvironmentVariables(config, env);

        // 2. Apply CLI arguments (highest priority)
        applyCLIArguments(config, args);

        log.debug("Configuration loaded: {}", config);
        return config;
    }

    private void applyEnvironmentVariables(BowlingCliConfig config, Map<String, String> env) {
        String format = env.get(ENV_OUTPUT_FORMAT);
        if (format != null && !format.isBlank()) {
            try {
                config.setOutputFormat(parseFormat(format));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring invalid {} value: {}", ENV_OUTPUT_FORMAT, format);
            }
        }

        String verbose = env.get(ENV_VERBOSE);
        if (verbose != null) {
            config.setVerbose(Boolean.parseBoolean(verbose.trim()));
        }
    }

    private void applyCLIArguments(BowlingCliConfig config, String[] args) {
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--scenario":
                case "-s":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Scenario not specified");
                    }
                    config.setScenarioSelection(args[++i]);
                    break;

                case "--format":
                case "-f":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output format not specified");
                    }
                    config.setOutputFormat(parseFormat(args[++i]));
                    break;

                case "--output":
                case "-o":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("Output file not specified");
                    }
                    config.setOutputFile(args[++i]);
                    break;

                case "--list":
                    config.setListOnly(true);
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
    }

    private static OutputFormat parseFormat(String value) {
        try {
            return OutputFormat.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid output format. Use: text or json");
        }
    }

    /**
     * Returns help text for the environment variables the CLI reads.
     */
    public static String getEnvironmentHelp() {
        return """
            Environment Variables:
              BOWLING_OUTPUT_FORMAT   Same as --format (text|json)
              BOWLING_VERBOSE         Same as --verbose (true|false)

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Built-in defaults
            """;
    }
}
