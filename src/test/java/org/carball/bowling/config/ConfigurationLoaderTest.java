package org.carball.bowling.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    private ConfigurationLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ConfigurationLoader();
    }

    @Test
    void shouldLoadDefaultConfiguration() {
        // When
        BowlingCliConfig config = loader.loadConfiguration(new String[0], Map.of());

        // Then
        assertThat(config.getScenarioSelection()).isEqualTo("all");
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.TEXT);
        assertThat(config.getOutputFile()).isNull();
        assertThat(config.isListOnly()).isFalse();
        assertThat(config.isVerbose()).isFalse();
    }

    @Test
    void shouldParseCLIArguments() {
        // Given
        String[] args = {
                "--scenario", "perfect,gutter",
                "-f", "json",
                "--output", "report.json",
                "--list",
                "-v"
        };

        // When
        BowlingCliConfig config = loader.loadConfiguration(args, Map.of());

        // Then
        assertThat(config.getScenarioSelection()).isEqualTo("perfect,gutter");
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.JSON);
        assertThat(config.getOutputFile()).isEqualTo("report.json");
        assertThat(config.isListOnly()).isTrue();
        assertThat(config.isVerbose()).isTrue();
    }

    @Test
    void shouldApplyEnvironmentVariables() {
        // Given
        Map<String, String> env = Map.of(
                "BOWLING_OUTPUT_FORMAT", "json",
                "BOWLING_VERBOSE", "true");

        // When
        BowlingCliConfig config = loader.loadConfiguration(new String[0], env);

        // Then
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.JSON);
        assertThat(config.isVerbose()).isTrue();
    }

    @Test
    void shouldPreferCLIArgumentsOverEnvironment() {
        // Given
        Map<String, String> env = Map.of("BOWLING_OUTPUT_FORMAT", "json");

        // When
        BowlingCliConfig config = loader.loadConfiguration(new String[]{"--format", "text"}, env);

        // Then
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.TEXT);
    }

    @Test
    void shouldIgnoreInvalidEnvironmentFormat() {
        // When
        BowlingCliConfig config = loader.loadConfiguration(new String[0], Map.of("BOWLING_OUTPUT_FORMAT", "xml"));

        // Then
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.TEXT);
    }

    @Test
    void shouldRejectInvalidCLIFormat() {
        assertThatThrownBy(() -> loader.loadConfiguration(new String[]{"--format", "xml"}, Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid output format");
    }

    @Test
    void shouldRejectUnknownOption() {
        assertThatThrownBy(() -> loader.loadConfiguration(new String[]{"--bogus"}, Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown option: --bogus");
    }

    @Test
    void shouldRejectMissingOptionValue() {
        assertThatThrownBy(() -> loader.loadConfiguration(new String[]{"--scenario"}, Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Scenario not specified");
    }

    @Test
    void shouldProvideEnvironmentHelp() {
        String help = ConfigurationLoader.getEnvironmentHelp();

        assertThat(help).contains("BOWLING_OUTPUT_FORMAT");
        assertThat(help).contains("BOWLING_VERBOSE");
        assertThat(help).contains("Priority Order");
    }
}
