package org.carball.bowling.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.carball.bowling.config.BowlingCliConfig;
import org.carball.bowling.config.ConfigurationLoader;
import org.carball.bowling.config.OutputFormat;
import org.carball.bowling.game.InvalidRollException;
import org.carball.bowling.output.ScenarioReport;
import org.carball.bowling.scenario.Scenario;
import org.carball.bowling.scenario.ScenarioCatalog;
import org.carball.bowling.scenario.ScenarioResult;
import org.carball.bowling.scenario.ScenarioRunner;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@Slf4j
public class BowlingCLI {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_MISMATCH = 2;

    private static final String VERSION = "1.0.0";
    private static final String PACKAGE_LOGGER = "org.carball.bowling";

    public static void main(String[] args) {
        System.exit(run(args, System.getenv(), System.out, System.err));
    }

    static int run(String[] args, Map<String, String> env, PrintStream out, PrintStream err) {
        return run(args, env, out, err, ScenarioCatalog::loadDefault);
    }

    static int run(String[] args, Map<String, String> env, PrintStream out, PrintStream err,
                   Supplier<ScenarioCatalog> catalogSource) {
        if (isHelpRequested(args)) {
            printUsage(out);
            return EXIT_OK;
        }

        Logger packageLogger = (Logger) LoggerFactory.getLogger(PACKAGE_LOGGER);
        Level previousLevel = packageLogger.getLevel();

        try {
            BowlingCliConfig config = new ConfigurationLoader().loadConfiguration(args, env);
            if (config.isVerbose()) {
                packageLogger.setLevel(Level.DEBUG);
            }

            ScenarioCatalog catalog = catalogSource.get();

            if (config.isListOnly()) {
                for (Scenario scenario : catalog.getAll()) {
                    out.printf("%-12s %s%n", scenario.getName(), scenario.getTitle());
                }
                return EXIT_OK;
            }

            List<Scenario> selected = catalog.select(config.getScenarioSelection());
            log.info("Running {} scenario(s)", selected.size());

            List<ScenarioResult> results = new ScenarioRunner().runAll(selected);
            ScenarioReport report = new ScenarioReport(results);
            String rendered = config.getOutputFormat() == OutputFormat.JSON ? report.toJson() : report.toText();

            if (config.getOutputFile() != null) {
                writeReport(Paths.get(config.getOutputFile()), rendered);
                out.println("Report written to " + config.getOutputFile());
            } else {
                out.print(rendered);
            }

            return report.isAllCorrect() ? EXIT_OK : EXIT_MISMATCH;

        } catch (InvalidRollException e) {
            err.println("Invalid scenario: " + e.getMessage());
            log.debug("Invalid scenario details", e);
            return EXIT_ERROR;
        } catch (IllegalArgumentException e) {
            err.println("Configuration error: " + e.getMessage());
            err.println("Run with --help for usage information.");
            log.debug("Configuration error details", e);
            return EXIT_ERROR;
        } catch (IOException e) {
            err.println("IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return EXIT_ERROR;
        } catch (Exception e) {
            err.println("Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return EXIT_ERROR;
        } finally {
            packageLogger.setLevel(previousLevel);
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void writeReport(Path target, String content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            throw new IllegalArgumentException("Output directory does not exist: " + parent);
        }
        Files.writeString(target, content);
    }

    private static void printUsage(PrintStream out) {
        out.println("Bowling Scorer v" + VERSION);
        out.println();
        out.println("Usage: java -jar bowling-scorer.jar [options]");
        out.println();
        out.println("Options:");
        out.println("  --scenario, -s      Comma-separated scenario names, or 'all' (default: all)");
        out.println("  --format, -f        Output format: text|json (default: text)");
        out.println("  --output, -o        Write the report to a file instead of stdout");
        out.println("  --list              List the available scenarios");
        out.println("  --verbose, -v       Enable verbose output");
        out.println("  --help, -h          Show this help message");
        out.println();
        out.print(ConfigurationLoader.getEnvironmentHelp());
        out.println();
        out.println("Exit codes:");
        out.println("  0  every scenario scored as expected");
        out.println("  1  configuration or IO error");
        out.println("  2  at least one scenario scored differently than expected");
    }
}
